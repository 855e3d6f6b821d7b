package me.golemcore.relay.domain.service;

import me.golemcore.relay.domain.model.ChatMetadata;
import me.golemcore.relay.domain.model.InboundMessage;
import me.golemcore.relay.domain.model.MessageCursor;
import me.golemcore.relay.infrastructure.config.AutoConfiguration;
import me.golemcore.relay.testsupport.InMemoryStoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChatHistoryServiceTest {

    private static final String CHAT_A = "111@g.us";
    private static final String CHAT_B = "222@g.us";
    private static final Instant BASE = Instant.parse("2026-03-01T10:00:00Z");

    private InMemoryStoragePort storage;
    private ChatHistoryService service;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStoragePort();
        service = new ChatHistoryService(storage, AutoConfiguration.objectMapper());
    }

    @Test
    void shouldReturnNewMessagesAcrossChatsInChronologicalOrder() {
        service.storeMessage(message("b1", CHAT_B, 3));
        service.storeMessage(message("a1", CHAT_A, 1));
        service.storeMessage(message("a2", CHAT_A, 5));

        List<InboundMessage> result = service.getNewMessages(List.of(CHAT_A, CHAT_B),
                new MessageCursor(BASE, null, null), 10);

        assertEquals(List.of("a1", "b1", "a2"), result.stream().map(InboundMessage::getId).toList());
    }

    @Test
    void shouldExcludeMessagesAtTheWatermark() {
        InboundMessage first = message("a1", CHAT_A, 1);
        service.storeMessage(first);
        service.storeMessage(message("a2", CHAT_A, 2));

        List<InboundMessage> result = service.getNewMessages(List.of(CHAT_A), MessageCursor.of(first), 10);

        assertEquals(List.of("a2"), result.stream().map(InboundMessage::getId).toList());
    }

    @Test
    void shouldKeepLaterMessagesWithinTheSameSecondAfterWatermark() {
        InboundMessage first = message("a1", CHAT_A, 1);
        service.storeMessage(first);
        service.storeMessage(message("a2", CHAT_A, 1));
        service.storeMessage(message("b1", CHAT_B, 1));

        List<InboundMessage> result = service.getNewMessages(List.of(CHAT_A, CHAT_B), MessageCursor.of(first), 10);

        assertEquals(List.of("a2", "b1"), result.stream().map(InboundMessage::getId).toList());
    }

    @Test
    void shouldResumeAfterBatchCutInsideOneSecond() {
        for (int i = 1; i <= 4; i++) {
            service.storeMessage(message("m" + i, CHAT_A, 1));
        }

        List<InboundMessage> firstBatch = service.getNewMessages(List.of(CHAT_A), null, 2);
        List<InboundMessage> secondBatch = service.getNewMessages(List.of(CHAT_A),
                MessageCursor.of(firstBatch.get(1)), 2);

        assertEquals(List.of("m1", "m2"), firstBatch.stream().map(InboundMessage::getId).toList());
        assertEquals(List.of("m3", "m4"), secondBatch.stream().map(InboundMessage::getId).toList());
    }

    @Test
    void shouldLimitBatchSize() {
        for (int i = 1; i <= 5; i++) {
            service.storeMessage(message("m" + i, CHAT_A, i));
        }

        assertEquals(3, service.getNewMessages(List.of(CHAT_A), null, 3).size());
    }

    @Test
    void shouldStoreDuplicateIdOnce() {
        assertTrue(service.storeMessage(message("dup", CHAT_A, 1)));
        assertFalse(service.storeMessage(message("dup", CHAT_A, 1)));

        ChatHistoryService reloaded = new ChatHistoryService(storage, AutoConfiguration.objectMapper());
        assertEquals(1, reloaded.getMessagesSince(CHAT_A, null).size());
    }

    @Test
    void shouldKeepLatestActivityAndNonBlankName() {
        service.recordChatMetadata(CHAT_A, "Family", BASE.plusSeconds(10), true);
        service.recordChatMetadata(CHAT_A, "", BASE, true);

        ChatMetadata chat = service.getChat(CHAT_A).orElseThrow();
        assertEquals("Family", chat.getName());
        assertEquals(BASE.plusSeconds(10), chat.getLastMessageTime());
    }

    @Test
    void shouldListGroupChatsMostRecentFirst() {
        service.recordChatMetadata(CHAT_A, "A", BASE, true);
        service.recordChatMetadata(CHAT_B, "B", BASE.plusSeconds(60), true);
        service.recordChatMetadata("44@s.whatsapp.net", "Direct", BASE.plusSeconds(120), false);
        service.updateChatNames(List.of(ChatMetadata.builder().identity("333@g.us").name("New").build()));

        List<String> ids = service.getGroupChats().stream().map(ChatMetadata::getIdentity).toList();

        assertEquals(List.of(CHAT_B, CHAT_A, "333@g.us"), ids);
    }

    @Test
    void shouldPersistLastGroupSync() {
        service.setLastGroupSync(BASE);

        ChatHistoryService reloaded = new ChatHistoryService(storage, AutoConfiguration.objectMapper());
        assertEquals(BASE, reloaded.getLastGroupSync().orElseThrow());
    }

    private static InboundMessage message(String id, String chat, int secondsAfterBase) {
        return InboundMessage.builder()
                .id(id)
                .chatIdentity(chat)
                .sender("user@s.whatsapp.net")
                .senderName("Alice")
                .body("hello " + id)
                .timestamp(BASE.plusSeconds(secondsAfterBase))
                .build();
    }
}
