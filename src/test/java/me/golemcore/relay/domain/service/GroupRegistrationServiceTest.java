package me.golemcore.relay.domain.service;

import me.golemcore.relay.domain.model.RegisteredGroup;
import me.golemcore.relay.domain.state.RouterState;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.GroupWorkspacePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GroupRegistrationServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String DM_IDENTITY = "telegram:4242";

    private RouterState routerState;
    private GroupWorkspacePort workspace;
    private GroupRegistrationService service;

    @BeforeEach
    void setUp() {
        routerState = mock(RouterState.class);
        workspace = mock(GroupWorkspacePort.class);
        service = new GroupRegistrationService(routerState, workspace, new RelayProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldValidateFolderNames() {
        assertTrue(GroupRegistrationService.isValidFolder("family"));
        assertTrue(GroupRegistrationService.isValidFolder("email-sender-alice@example.com"));
        assertFalse(GroupRegistrationService.isValidFolder("../etc"));
        assertFalse(GroupRegistrationService.isValidFolder("a/b"));
        assertFalse(GroupRegistrationService.isValidFolder(".hidden"));
        assertFalse(GroupRegistrationService.isValidFolder("x..y"));
        assertFalse(GroupRegistrationService.isValidFolder(""));
        assertFalse(GroupRegistrationService.isValidFolder(null));
        assertFalse(GroupRegistrationService.isValidFolder("errors"));
        assertFalse(GroupRegistrationService.isValidFolder("Errors"));
        assertTrue(GroupRegistrationService.isValidFolder("errors-log"));
    }

    @Test
    void shouldRegisterGroupWithCreationTime() {
        RegisteredGroup group = service.register("111@g.us", RegisteredGroup.builder()
                .name("Family").folder("family").trigger("@bot").build());

        assertEquals(NOW, group.getAddedAt());
        verify(workspace).ensureGroupDirectory("family");
        verify(routerState).registerGroup("111@g.us", group);
    }

    @Test
    void shouldRejectUnsafeFolder() {
        RegisteredGroup group = RegisteredGroup.builder().name("Evil").folder("../../root").build();

        assertThrows(IllegalArgumentException.class, () -> service.register("111@g.us", group));
        verify(routerState, never()).registerGroup(anyString(), any());
    }

    @Test
    void shouldAutoRegisterDirectChatOnce() {
        when(routerState.findGroup(DM_IDENTITY)).thenReturn(Optional.empty());
        when(workspace.writeFileIfAbsent(eq("telegram-dm-4242"), eq("AGENTS.md"), anyString())).thenReturn(true);

        RegisteredGroup group = service.registerDirectChat(DM_IDENTITY, "Alice", "telegram-dm-4242");

        assertTrue(group.isAutoRespond());
        verify(routerState).registerGroup(DM_IDENTITY, group);
        verify(workspace).writeFileIfAbsent(eq("telegram-dm-4242"), eq("AGENTS.md"), contains("Alice"));
    }

    @Test
    void shouldReturnExistingDirectChat() {
        RegisteredGroup existing = RegisteredGroup.builder().name("Alice").folder("telegram-dm-4242").build();
        when(routerState.findGroup(DM_IDENTITY)).thenReturn(Optional.of(existing));

        assertSame(existing, service.registerDirectChat(DM_IDENTITY, "Alice", "telegram-dm-4242"));
        verify(routerState, never()).registerGroup(anyString(), any());
    }
}
