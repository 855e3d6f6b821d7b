package me.golemcore.relay.domain.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.relay.domain.model.MessageCursor;
import me.golemcore.relay.domain.model.RegisteredGroup;
import me.golemcore.relay.infrastructure.config.AutoConfiguration;
import me.golemcore.relay.testsupport.InMemoryStoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RouterStateTest {

    private static final String GROUP_JID = "120363@g.us";
    private static final Instant T1 = Instant.parse("2026-03-01T10:00:00Z");
    private static final Instant T2 = Instant.parse("2026-03-01T10:05:00Z");

    private InMemoryStoragePort storage;
    private ObjectMapper objectMapper;
    private RouterState state;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStoragePort();
        objectMapper = AutoConfiguration.objectMapper();
        state = new RouterState(storage, objectMapper);
        state.load();
    }

    @Test
    void shouldStartEmptyWithoutStateFiles() {
        assertTrue(state.getRegisteredGroups().isEmpty());
        assertNull(state.getLastDelivered());
        assertTrue(state.getSession("main").isEmpty());
    }

    @Test
    void shouldPersistRegisteredGroupsAcrossReload() {
        state.registerGroup(GROUP_JID, RegisteredGroup.builder()
                .name("Family").folder("family").trigger("@bot").addedAt(T1).build());

        RouterState reloaded = new RouterState(storage, objectMapper);
        reloaded.load();

        assertTrue(reloaded.isRegistered(GROUP_JID));
        assertEquals("family", reloaded.findGroup(GROUP_JID).orElseThrow().getFolder());
        assertEquals(GROUP_JID, reloaded.findIdentityByFolder("family").orElseThrow());
    }

    @Test
    void shouldOnlyMoveWatermarkForward() {
        MessageCursor later = new MessageCursor(T2, "m1", GROUP_JID);
        assertTrue(state.advanceLastDelivered(later));
        assertFalse(state.advanceLastDelivered(new MessageCursor(T1, "m9", GROUP_JID)));
        assertFalse(state.advanceLastDelivered(later));

        assertEquals(later, state.getLastDelivered());
    }

    @Test
    void shouldAdvanceWatermarkWithinOneSecondByMessageId() {
        assertTrue(state.advanceLastDelivered(new MessageCursor(T1, "m1", GROUP_JID)));
        assertTrue(state.advanceLastDelivered(new MessageCursor(T1, "m2", GROUP_JID)));
        assertFalse(state.advanceLastDelivered(new MessageCursor(T1, "m1", GROUP_JID)));

        RouterState reloaded = new RouterState(storage, objectMapper);
        reloaded.load();

        assertEquals(new MessageCursor(T1, "m2", GROUP_JID), reloaded.getLastDelivered());
    }

    @Test
    void shouldKeepAgentRunsPerChat() {
        state.advanceLastAgentRun(GROUP_JID, new MessageCursor(T1, "a", GROUP_JID));
        state.advanceLastAgentRun("other@g.us", new MessageCursor(T2, "b", "other@g.us"));
        assertFalse(state.advanceLastAgentRun(GROUP_JID, new MessageCursor(T1, "a", GROUP_JID)));

        RouterState reloaded = new RouterState(storage, objectMapper);
        reloaded.load();

        assertEquals(T1, reloaded.getLastAgentRun(GROUP_JID).orElseThrow().timestamp());
        assertEquals("b", reloaded.getLastAgentRun("other@g.us").orElseThrow().messageId());
    }

    @Test
    void shouldIgnoreNullSessionToken() {
        state.setSession("main", "sess-1");
        state.setSession("main", null);

        assertEquals("sess-1", state.getSession("main").orElseThrow());
    }

    @Test
    void shouldStartFromEmptyStateWhenFileIsCorrupt() {
        storage.putTextAtomic(RouterState.STATE_DIR, RouterState.GROUPS_FILE, "{not json");

        RouterState reloaded = new RouterState(storage, objectMapper);
        reloaded.load();

        assertTrue(reloaded.getRegisteredGroups().isEmpty());
    }
}
