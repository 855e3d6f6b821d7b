/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.relay.adapter.inbound.telegram;

import me.golemcore.relay.domain.model.ChannelEvent;
import me.golemcore.relay.domain.model.HostChangeCallbackEvent;
import me.golemcore.relay.domain.model.HostModificationRequest;
import me.golemcore.relay.domain.service.ChatIdentities;
import me.golemcore.relay.domain.service.GroupRegistrationService;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.inbound.ChannelPort;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.ActionType;
import org.telegram.telegrambots.meta.api.methods.send.SendChatAction;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.chat.Chat;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardRow;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Telegram channel using long polling.
 *
 * <p>
 * Chats are identified as {@code telegram:<chatId>}. Private chats register
 * themselves on first contact as {@code telegram-dm-<userId>} and respond to
 * every message; group chats have to be registered by the privileged group.
 * Host change prompts carry inline Approve/Deny buttons whose callbacks are
 * published as {@link HostChangeCallbackEvent}.
 *
 * <p>
 * Telegram has no way to clear the typing action, so {@code setTyping(false)}
 * is a no-op and the indicator expires by itself.
 */
@Component
@Slf4j
public class TelegramAdapter implements ChannelPort, LongPollingSingleThreadUpdateConsumer {

    private static final int TELEGRAM_MAX_MESSAGE_LENGTH = 4096;
    private static final String CALLBACK_PREFIX = "hc:";
    private static final int CALLBACK_DATA_PARTS_COUNT = 3;
    private static final String DIRECT_FOLDER_PREFIX = "telegram-dm-";

    private final RelayProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final TelegramBotsLongPollingApplication botsApplication;
    private final GroupRegistrationService groupRegistrationService;
    private final Clock clock;
    private final Object lifecycleLock = new Object();

    private TelegramClient telegramClient;
    private volatile boolean running = false;

    public TelegramAdapter(RelayProperties properties, ApplicationEventPublisher eventPublisher,
            TelegramBotsLongPollingApplication botsApplication, GroupRegistrationService groupRegistrationService,
            Clock clock) {
        this.properties = properties;
        this.eventPublisher = eventPublisher;
        this.botsApplication = botsApplication;
        this.groupRegistrationService = groupRegistrationService;
        this.clock = clock;
    }

    /**
     * Package-private setter for testing, allows injecting a mock client.
     */
    void setTelegramClient(TelegramClient client) {
        this.telegramClient = client;
    }

    @Override
    public String getChannelType() {
        return ChatIdentities.TELEGRAM;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                return;
            }
            RelayProperties.TelegramProperties config = properties.getChannels().getTelegram();
            if (!config.isEnabled()) {
                log.info("[Telegram] Channel disabled");
                return;
            }
            if (telegramClient == null) {
                telegramClient = new OkHttpTelegramClient(config.getToken());
            }
            try {
                botsApplication.registerBot(config.getToken(), this);
                running = true;
                log.info("[Telegram] Adapter started");
            } catch (TelegramApiException e) {
                log.error("[Telegram] Failed to start adapter", e);
            }
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            try {
                botsApplication.close();
                log.info("[Telegram] Adapter stopped");
            } catch (Exception e) { // NOSONAR - close() declares Exception
                log.error("[Telegram] Error stopping adapter", e);
            }
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getMaxMessageLength() {
        return TELEGRAM_MAX_MESSAGE_LENGTH;
    }

    @Override
    public void consume(Update update) {
        try {
            if (update.hasCallbackQuery()) {
                handleCallback(update.getCallbackQuery());
            } else if (update.hasMessage()) {
                handleMessage(update.getMessage());
            }
        } catch (RuntimeException e) {
            log.error("[Telegram] Failed to handle update {}", update.getUpdateId(), e);
        }
    }

    private void handleMessage(Message message) {
        User from = message.getFrom();
        Chat chat = message.getChat();
        String chatIdentity = ChatIdentities.telegram(message.getChatId().toString());
        String userId = from != null ? from.getId().toString() : null;

        if (userId != null && !isAllowed(userId)) {
            log.warn("[Telegram] Ignoring message from user {} not in allow-from", userId);
            return;
        }

        String senderName = from != null ? displayName(from) : null;
        boolean group = !chat.isUserChat();
        boolean fromBot = from != null && Boolean.TRUE.equals(from.getIsBot());

        if (!group && userId != null && !fromBot) {
            groupRegistrationService.registerDirectChat(chatIdentity, senderName, DIRECT_FOLDER_PREFIX + userId);
        }

        String body = message.hasText() ? message.getText() : message.getCaption();
        Instant timestamp = message.getDate() != null
                ? Instant.ofEpochSecond(message.getDate())
                : clock.instant();

        eventPublisher.publishEvent(ChannelEvent.builder()
                .channelType(ChatIdentities.TELEGRAM)
                .messageId("tg-" + message.getChatId() + "-" + message.getMessageId())
                .chatIdentity(chatIdentity)
                .chatName(group ? chat.getTitle() : senderName)
                .sender(userId != null ? ChatIdentities.telegram(userId) : null)
                .senderName(senderName)
                .body(body)
                .timestamp(timestamp)
                .fromSelf(false)
                .fromBot(fromBot)
                .group(group)
                .build());
    }

    private void handleCallback(CallbackQuery callback) {
        String data = callback.getData();
        if (callback.getMessage() == null || data == null || !data.startsWith(CALLBACK_PREFIX)) {
            log.debug("[Telegram] Ignoring callback: {}", data);
            return;
        }
        String[] parts = data.split(":");
        if (parts.length != CALLBACK_DATA_PARTS_COUNT) {
            log.warn("[Telegram] Invalid host change callback data: {}", data);
            return;
        }
        String userId = callback.getFrom().getId().toString();
        if (!isAllowed(userId)) {
            log.warn("[Telegram] Ignoring callback from user {} not in allow-from", userId);
            return;
        }

        String chatId = callback.getMessage().getChatId().toString();
        Integer messageId = callback.getMessage().getMessageId();
        String userName = displayName(callback.getFrom());
        removeButtons(chatId, messageId, parts[1], parts[2], userName);
        eventPublisher.publishEvent(new HostChangeCallbackEvent(parts[1], parts[2],
                ChatIdentities.telegram(chatId), messageId.toString(), userName));
    }

    private void removeButtons(String chatId, Integer messageId, String requestId, String action, String userName) {
        try {
            telegramClient.execute(EditMessageText.builder()
                    .chatId(chatId)
                    .messageId(messageId)
                    .text("Host changes request " + requestId + ": " + action + " (" + userName + ")")
                    .build());
        } catch (TelegramApiException e) {
            log.debug("[Telegram] Failed to update approval prompt: {}", e.getMessage());
        }
    }

    @Override
    public CompletableFuture<Void> sendMessage(String chatIdentity, String content) {
        return CompletableFuture.runAsync(() -> execute(SendMessage.builder()
                .chatId(ChatIdentities.nativeId(chatIdentity))
                .text(content)
                .build()));
    }

    @Override
    public CompletableFuture<Void> sendApprovalPrompt(String chatIdentity, HostModificationRequest request,
            String plainTextPrompt) {
        InlineKeyboardMarkup keyboard = InlineKeyboardMarkup.builder()
                .keyboardRow(new InlineKeyboardRow(
                        InlineKeyboardButton.builder()
                                .text("✅ Approve")
                                .callbackData(CALLBACK_PREFIX + request.getId() + ":approve")
                                .build(),
                        InlineKeyboardButton.builder()
                                .text("❌ Deny")
                                .callbackData(CALLBACK_PREFIX + request.getId() + ":deny")
                                .build()))
                .build();
        return CompletableFuture.runAsync(() -> execute(SendMessage.builder()
                .chatId(ChatIdentities.nativeId(chatIdentity))
                .text(plainTextPrompt)
                .replyMarkup(keyboard)
                .build()));
    }

    @Override
    public void setTyping(String chatIdentity, boolean typing) {
        if (!typing) {
            return;
        }
        try {
            telegramClient.execute(SendChatAction.builder()
                    .chatId(ChatIdentities.nativeId(chatIdentity))
                    .action(ActionType.TYPING.toString())
                    .build());
        } catch (TelegramApiException e) {
            log.debug("[Telegram] Failed to send typing indicator: {}", e.getMessage());
        }
    }

    private void execute(SendMessage message) {
        try {
            telegramClient.execute(message);
        } catch (TelegramApiException e) {
            throw new IllegalStateException("Failed to send message to chat " + message.getChatId(), e);
        }
    }

    private boolean isAllowed(String userId) {
        List<String> allowFrom = properties.getChannels().getTelegram().getAllowFrom();
        return allowFrom == null || allowFrom.isEmpty() || allowFrom.contains(userId);
    }

    private static String displayName(User user) {
        if (user.getUserName() != null && !user.getUserName().isBlank()) {
            return user.getUserName();
        }
        String lastName = user.getLastName() != null ? " " + user.getLastName() : "";
        return user.getFirstName() + lastName;
    }
}
