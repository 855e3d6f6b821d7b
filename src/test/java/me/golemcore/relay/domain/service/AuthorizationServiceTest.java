package me.golemcore.relay.domain.service;

import me.golemcore.relay.domain.model.InboundMessage;
import me.golemcore.relay.domain.model.RegisteredGroup;
import me.golemcore.relay.domain.state.RouterState;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AuthorizationServiceTest {

    private static final String FAMILY_JID = "111@g.us";
    private static final String WORK_JID = "222@g.us";

    private RouterState routerState;
    private AuthorizationService service;

    @BeforeEach
    void setUp() {
        routerState = mock(RouterState.class);
        service = new AuthorizationService(routerState, new RelayProperties());

        when(routerState.findGroup(FAMILY_JID)).thenReturn(Optional.of(RegisteredGroup.builder()
                .name("Family").folder("family").trigger("@bot").build()));
        when(routerState.findGroup(WORK_JID)).thenReturn(Optional.of(RegisteredGroup.builder()
                .name("Work").folder("work").trigger("").build()));
        when(routerState.findGroup("333@g.us")).thenReturn(Optional.empty());
    }

    @Test
    void shouldMatchTriggerCaseInsensitivelyAtWordBoundary() {
        RegisteredGroup group = RegisteredGroup.builder().folder("family").trigger("@bot").build();

        assertTrue(service.matchesTrigger(group, "@bot what's the weather"));
        assertTrue(service.matchesTrigger(group, "@BOT hi"));
        assertTrue(service.matchesTrigger(group, "  @bot"));
        assertFalse(service.matchesTrigger(group, "@bottle of wine"));
        assertFalse(service.matchesTrigger(group, "hey @bot"));
        assertFalse(service.matchesTrigger(group, null));
    }

    @Test
    void shouldAutoRespondWhenTriggerIsEmpty() {
        assertTrue(service.eligibleGroup(message(WORK_JID, "anything")).isPresent());
    }

    @Test
    void shouldRejectUnregisteredChatOrMissingTrigger() {
        assertTrue(service.eligibleGroup(message("333@g.us", "@bot hi")).isEmpty());
        assertTrue(service.eligibleGroup(message(FAMILY_JID, "hi there")).isEmpty());
        assertTrue(service.eligibleGroup(message(FAMILY_JID, "@bot hi")).isPresent());
    }

    @Test
    void shouldLetOnlyPrivilegedGroupActOnOtherGroups() {
        assertTrue(service.canActOn("main", "family"));
        assertTrue(service.canActOn("family", "family"));
        assertFalse(service.canActOn("family", "work"));
        assertFalse(service.canActOn("family", null));
    }

    @Test
    void shouldLetGroupAddressOnlyItsOwnChat() {
        assertTrue(service.canAddressChat("family", FAMILY_JID));
        assertFalse(service.canAddressChat("family", WORK_JID));
        assertFalse(service.canAddressChat("family", "333@g.us"));
        assertTrue(service.canAddressChat("main", "333@g.us"));
    }

    private static InboundMessage message(String chat, String body) {
        return InboundMessage.builder().id("m1").chatIdentity(chat).body(body).build();
    }
}
