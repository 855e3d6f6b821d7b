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

package me.golemcore.relay.domain.service;

import me.golemcore.relay.domain.model.ChannelEvent;
import me.golemcore.relay.domain.model.InboundMessage;
import me.golemcore.relay.domain.state.RouterState;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns platform events into {@link InboundMessage}s.
 *
 * <p>
 * Chat metadata is recorded for every chat, registered or not. Status
 * broadcasts, bot-authored messages and the relay's own echoed replies are
 * dropped. Alias identities are translated through the {@link AliasTable}.
 * Messages of registered chats are stored for the router to pick up.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChannelNormalizer {

    static final String STATUS_BROADCAST = "status@broadcast";

    private final AliasTable aliasTable;
    private final ChatHistoryService chatHistoryService;
    private final RouterState routerState;
    private final RelayProperties properties;
    private final Clock clock;

    @EventListener
    public void onChannelEvent(ChannelEvent event) {
        normalize(event);
    }

    public Optional<InboundMessage> normalize(ChannelEvent event) {
        if (event.getChatIdentity() == null || STATUS_BROADCAST.equals(event.getChatIdentity())) {
            return Optional.empty();
        }

        String chatIdentity = aliasTable.resolve(event.getChatIdentity());
        Instant timestamp = event.getTimestamp() != null ? event.getTimestamp() : Instant.now(clock);
        chatHistoryService.recordChatMetadata(chatIdentity, event.getChatName(), timestamp, event.isGroup());

        if (event.isFromBot()) {
            log.trace("[Normalizer] Bot-authored message ignored: chat={}", chatIdentity);
            return Optional.empty();
        }
        String body = event.getBody();
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        if (event.isFromSelf() && body.startsWith(properties.getAssistantName() + ":")) {
            log.trace("[Normalizer] Own echo ignored: chat={}", chatIdentity);
            return Optional.empty();
        }
        if (!routerState.isRegistered(chatIdentity)) {
            log.trace("[Normalizer] Unregistered chat, metadata only: {}", chatIdentity);
            return Optional.empty();
        }

        InboundMessage message = InboundMessage.builder()
                .id(event.getMessageId() != null ? event.getMessageId() : UUID.randomUUID().toString())
                .chatIdentity(chatIdentity)
                .sender(aliasTable.resolve(event.getSender()))
                .senderName(event.getSenderName() != null ? event.getSenderName() : event.getSender())
                .body(body)
                .timestamp(timestamp)
                .build();
        chatHistoryService.storeMessage(message);
        log.debug("[Normalizer] Stored message: chat={}, id={}", chatIdentity, message.getId());
        return Optional.of(message);
    }
}
