package me.golemcore.relay.domain.service;

import me.golemcore.relay.domain.model.ChannelEvent;
import me.golemcore.relay.domain.model.InboundMessage;
import me.golemcore.relay.domain.state.RouterState;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChannelNormalizerTest {

    private static final String GROUP_JID = "120363@g.us";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private AliasTable aliasTable;
    private ChatHistoryService chatHistoryService;
    private RouterState routerState;
    private ChannelNormalizer normalizer;

    @BeforeEach
    void setUp() {
        aliasTable = new AliasTable();
        chatHistoryService = mock(ChatHistoryService.class);
        routerState = mock(RouterState.class);
        RelayProperties properties = new RelayProperties();
        properties.setAssistantName("Andy");
        normalizer = new ChannelNormalizer(aliasTable, chatHistoryService, routerState, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
        when(routerState.isRegistered(GROUP_JID)).thenReturn(true);
    }

    @Test
    void shouldStoreMessageFromRegisteredChat() {
        Optional<InboundMessage> result = normalizer.normalize(event(GROUP_JID, "@Andy hello").build());

        assertTrue(result.isPresent());
        ArgumentCaptor<InboundMessage> captor = ArgumentCaptor.forClass(InboundMessage.class);
        verify(chatHistoryService).storeMessage(captor.capture());
        assertEquals("m1", captor.getValue().getId());
        assertEquals("@Andy hello", captor.getValue().getBody());
        assertEquals("Alice", captor.getValue().getSenderName());
    }

    @Test
    void shouldRecordMetadataButNotStoreForUnregisteredChat() {
        Optional<InboundMessage> result = normalizer.normalize(event("999@g.us", "hello")
                .chatName("Strangers").build());

        assertTrue(result.isEmpty());
        verify(chatHistoryService).recordChatMetadata(eq("999@g.us"), eq("Strangers"), any(), eq(true));
        verify(chatHistoryService, never()).storeMessage(any());
    }

    @Test
    void shouldDropStatusBroadcastEntirely() {
        assertTrue(normalizer.normalize(event(ChannelNormalizer.STATUS_BROADCAST, "story").build()).isEmpty());

        verify(chatHistoryService, never()).recordChatMetadata(anyString(), any(), any(), anyBoolean());
    }

    @Test
    void shouldDropOwnEchoAndBotMessages() {
        assertTrue(normalizer.normalize(event(GROUP_JID, "Andy: here is the answer").fromSelf(true).build())
                .isEmpty());
        assertTrue(normalizer.normalize(event(GROUP_JID, "beep").fromBot(true).build()).isEmpty());

        verify(chatHistoryService, never()).storeMessage(any());
    }

    @Test
    void shouldKeepSelfMessageWithoutAssistantPrefix() {
        assertTrue(normalizer.normalize(event(GROUP_JID, "note to self").fromSelf(true).build()).isPresent());
    }

    @Test
    void shouldResolveAliasToCanonicalIdentity() {
        aliasTable.register("120363@lid", GROUP_JID);

        InboundMessage message = normalizer.normalize(event("120363@lid", "hi").build()).orElseThrow();

        assertEquals(GROUP_JID, message.getChatIdentity());
    }

    @Test
    void shouldPassUnknownAliasThrough() {
        assertEquals("unknown@lid", aliasTable.resolve("unknown@lid"));
    }

    @Test
    void shouldUseClockWhenTimestampMissing() {
        InboundMessage message = normalizer.normalize(event(GROUP_JID, "hi").timestamp(null).build())
                .orElseThrow();

        assertEquals(NOW, message.getTimestamp());
    }

    private static ChannelEvent.ChannelEventBuilder event(String chat, String body) {
        return ChannelEvent.builder()
                .channelType(ChatIdentities.SOCKET)
                .messageId("m1")
                .chatIdentity(chat)
                .sender("555@s.whatsapp.net")
                .senderName("Alice")
                .body(body)
                .timestamp(NOW.minusSeconds(5))
                .group(true);
    }
}
