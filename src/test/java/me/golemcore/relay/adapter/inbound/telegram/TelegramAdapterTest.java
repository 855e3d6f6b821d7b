package me.golemcore.relay.adapter.inbound.telegram;

import me.golemcore.relay.domain.model.ChannelEvent;
import me.golemcore.relay.domain.model.HostChangeCallbackEvent;
import me.golemcore.relay.domain.model.HostModificationRequest;
import me.golemcore.relay.domain.service.GroupRegistrationService;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.chat.Chat;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TelegramAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private RelayProperties properties;
    private ApplicationEventPublisher eventPublisher;
    private GroupRegistrationService groupRegistrationService;
    private TelegramClient telegramClient;
    private TelegramAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new RelayProperties();
        properties.getChannels().getTelegram().setEnabled(true);
        properties.getChannels().getTelegram().setToken("test-token");
        eventPublisher = mock(ApplicationEventPublisher.class);
        groupRegistrationService = mock(GroupRegistrationService.class);
        telegramClient = mock(TelegramClient.class);

        adapter = new TelegramAdapter(properties, eventPublisher, mock(TelegramBotsLongPollingApplication.class),
                groupRegistrationService, Clock.fixed(NOW, ZoneOffset.UTC));
        adapter.setTelegramClient(telegramClient);
    }

    @Test
    void shouldPublishGroupMessageAsChannelEvent() {
        Update update = messageUpdate(-1001L, false, "Family", 42L, "alice", "@bot hi");

        adapter.consume(update);

        ArgumentCaptor<ChannelEvent> captor = ArgumentCaptor.forClass(ChannelEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        ChannelEvent event = captor.getValue();
        assertEquals("telegram:-1001", event.getChatIdentity());
        assertEquals("tg--1001-7", event.getMessageId());
        assertEquals("telegram:42", event.getSender());
        assertEquals("alice", event.getSenderName());
        assertEquals("Family", event.getChatName());
        assertEquals("@bot hi", event.getBody());
        assertEquals(Instant.ofEpochSecond(1_700_000_000L), event.getTimestamp());
        assertTrue(event.isGroup());
        verify(groupRegistrationService, never()).registerDirectChat(anyString(), anyString(), anyString());
    }

    @Test
    void shouldAutoRegisterPrivateChat() {
        Update update = messageUpdate(42L, true, null, 42L, "alice", "hello");

        adapter.consume(update);

        verify(groupRegistrationService).registerDirectChat("telegram:42", "alice", "telegram-dm-42");
        ArgumentCaptor<ChannelEvent> captor = ArgumentCaptor.forClass(ChannelEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertFalse(captor.getValue().isGroup());
        assertEquals("alice", captor.getValue().getChatName());
    }

    @Test
    void shouldIgnoreUsersOutsideAllowList() {
        properties.getChannels().getTelegram().setAllowFrom(List.of("7"));

        adapter.consume(messageUpdate(42L, true, null, 42L, "alice", "hello"));

        verify(eventPublisher, never()).publishEvent(any(Object.class));
        verify(groupRegistrationService, never()).registerDirectChat(anyString(), anyString(), anyString());
    }

    @Test
    void shouldPublishHostChangeCallback() throws TelegramApiException {
        adapter.consume(callbackUpdate(42L, 99, "hc:hc-1:approve"));

        ArgumentCaptor<HostChangeCallbackEvent> captor = ArgumentCaptor.forClass(HostChangeCallbackEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        HostChangeCallbackEvent event = captor.getValue();
        assertEquals("hc-1", event.requestId());
        assertEquals("approve", event.action());
        assertEquals("telegram:42", event.chatIdentity());
        assertEquals("99", event.messageId());
        assertEquals("alice", event.userName());
        verify(telegramClient).execute(any(EditMessageText.class));
    }

    @Test
    void shouldIgnoreMalformedOrForeignCallbacks() {
        adapter.consume(callbackUpdate(42L, 99, "hc:hc-1"));
        adapter.consume(callbackUpdate(42L, 99, "lang:en"));

        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void shouldSendApprovalPromptWithButtons() throws TelegramApiException {
        HostModificationRequest request = HostModificationRequest.builder().id("hc-1").build();

        adapter.sendApprovalPrompt("telegram:42", request, "Apply host changes?").join();

        ArgumentCaptor<SendMessage> captor = ArgumentCaptor.forClass(SendMessage.class);
        verify(telegramClient).execute(captor.capture());
        assertEquals("42", captor.getValue().getChatId());
        InlineKeyboardMarkup markup = (InlineKeyboardMarkup) captor.getValue().getReplyMarkup();
        assertEquals("hc:hc-1:approve", markup.getKeyboard().get(0).get(0).getCallbackData());
        assertEquals("hc:hc-1:deny", markup.getKeyboard().get(0).get(1).getCallbackData());
    }

    @Test
    void shouldFailSendWhenTelegramRejects() throws TelegramApiException {
        when(telegramClient.execute(any(SendMessage.class))).thenThrow(new TelegramApiException("429"));

        CompletableFuture<Void> future = adapter.sendMessage("telegram:42", "hi");

        assertThrows(CompletionException.class, future::join);
    }

    private static Update messageUpdate(long chatId, boolean privateChat, String title, long userId,
            String userName, String text) {
        User user = mock(User.class);
        when(user.getId()).thenReturn(userId);
        when(user.getUserName()).thenReturn(userName);
        when(user.getIsBot()).thenReturn(false);

        Chat chat = mock(Chat.class);
        when(chat.isUserChat()).thenReturn(privateChat);
        when(chat.getTitle()).thenReturn(title);

        Message message = mock(Message.class);
        when(message.getFrom()).thenReturn(user);
        when(message.getChat()).thenReturn(chat);
        when(message.getChatId()).thenReturn(chatId);
        when(message.getMessageId()).thenReturn(7);
        when(message.hasText()).thenReturn(true);
        when(message.getText()).thenReturn(text);
        when(message.getDate()).thenReturn(1_700_000_000);

        Update update = mock(Update.class);
        when(update.hasCallbackQuery()).thenReturn(false);
        when(update.hasMessage()).thenReturn(true);
        when(update.getMessage()).thenReturn(message);
        return update;
    }

    private static Update callbackUpdate(long chatId, int messageId, String data) {
        User user = mock(User.class);
        when(user.getId()).thenReturn(42L);
        when(user.getUserName()).thenReturn("alice");

        Message message = mock(Message.class);
        when(message.getChatId()).thenReturn(chatId);
        when(message.getMessageId()).thenReturn(messageId);

        CallbackQuery callback = mock(CallbackQuery.class);
        when(callback.getData()).thenReturn(data);
        when(callback.getMessage()).thenReturn(message);
        when(callback.getFrom()).thenReturn(user);

        Update update = mock(Update.class);
        when(update.hasCallbackQuery()).thenReturn(true);
        when(update.getCallbackQuery()).thenReturn(callback);
        return update;
    }
}
