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


package me.golemcore.relay.adapter.inbound.socket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.relay.domain.model.ChannelConnectedEvent;
import me.golemcore.relay.domain.model.ChannelEvent;
import me.golemcore.relay.domain.model.ChatMetadata;
import me.golemcore.relay.domain.model.GroupMetadataEvent;
import me.golemcore.relay.domain.service.AliasTable;
import me.golemcore.relay.domain.service.ChatIdentities;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.infrastructure.lifecycle.FatalConditionHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Inbound side of the messaging socket. Accepts one bridge connection,
 * authenticated by the {@code token} query parameter, and turns its JSON
 * frames into application events:
 *
 * <ul>
 * <li>{@code hello {self, aliases[]}} registers alias identities</li>
 * <li>{@code message {...}} becomes a {@link ChannelEvent}</li>
 * <li>{@code group_metadata {groups[]}} becomes a
 * {@link GroupMetadataEvent}</li>
 * <li>{@code logout} means the bridge lost its platform session; the relay
 * exits</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SocketWebSocketHandler implements WebSocketHandler {

    private final SocketChannelAdapter channelAdapter;
    private final AliasTable aliasTable;
    private final ApplicationEventPublisher eventPublisher;
    private final FatalConditionHandler fatalConditionHandler;
    private final ObjectMapper objectMapper;
    private final RelayProperties properties;
    private final Clock clock;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        if (!channelAdapter.isRunning()) {
            log.warn("[Socket] Connection rejected: channel not running");
            return session.close();
        }
        String token = extractToken(session);
        if (!isValidToken(token)) {
            log.warn("[Socket] Connection rejected: invalid or missing token");
            return session.close();
        }

        log.info("[Socket] Bridge connected: session={}", session.getId());
        channelAdapter.attach(session);

        return session.receive()
                .doOnNext(wsMessage -> handleFrame(wsMessage.getPayloadAsText()))
                .doFinally(signal -> {
                    log.info("[Socket] Bridge disconnected: session={}, signal={}", session.getId(), signal);
                    channelAdapter.detach(session);
                })
                .then();
    }

    void handleFrame(String payload) {
        try {
            JsonNode frame = objectMapper.readTree(payload);
            String type = frame.path("type").asText("");
            switch (type) {
            case "hello" -> handleHello(frame);
            case "message" -> handleMessage(frame);
            case "group_metadata" -> handleGroupMetadata(frame);
            case "logout" -> fatalConditionHandler.fatal(
                    "Socket bridge reported logout; re-authenticate the messaging account and restart",
                    FatalConditionHandler.STATUS_LOGGED_OUT);
            default -> log.debug("[Socket] Ignoring frame type: {}", type);
            }
        } catch (IOException | RuntimeException e) { // NOSONAR
            log.warn("[Socket] Failed to process incoming frame: {}", e.getMessage());
        }
    }

    private void handleHello(JsonNode frame) {
        String self = textOrNull(frame, "self");
        if (self == null) {
            return;
        }
        for (JsonNode alias : frame.path("aliases")) {
            aliasTable.register(alias.asText(), self);
        }
        log.info("[Socket] Bridge identified as {} ({} alias(es))", self, frame.path("aliases").size());
        eventPublisher.publishEvent(new ChannelConnectedEvent(ChatIdentities.SOCKET));
    }

    private void handleMessage(JsonNode frame) {
        String chat = textOrNull(frame, "chat");
        if (chat == null) {
            log.debug("[Socket] Message frame without chat ignored");
            return;
        }
        Instant timestamp = frame.hasNonNull("timestamp")
                ? Instant.ofEpochSecond(frame.get("timestamp").asLong())
                : clock.instant();
        eventPublisher.publishEvent(ChannelEvent.builder()
                .channelType(ChatIdentities.SOCKET)
                .messageId(textOrNull(frame, "id"))
                .chatIdentity(chat)
                .chatName(textOrNull(frame, "chatName"))
                .sender(textOrNull(frame, "sender"))
                .senderName(textOrNull(frame, "senderName"))
                .body(textOrNull(frame, "text"))
                .timestamp(timestamp)
                .fromSelf(frame.path("fromMe").asBoolean(false))
                .fromBot(frame.path("fromBot").asBoolean(false))
                .group(frame.path("group").asBoolean(chat.endsWith("@g.us")))
                .build());
    }

    private void handleGroupMetadata(JsonNode frame) {
        List<ChatMetadata> chats = new ArrayList<>();
        for (JsonNode group : frame.path("groups")) {
            String chat = textOrNull(group, "chat");
            if (chat == null) {
                continue;
            }
            chats.add(ChatMetadata.builder()
                    .identity(aliasTable.resolve(chat))
                    .name(textOrNull(group, "name"))
                    .group(true)
                    .build());
        }
        log.info("[Socket] Received metadata for {} group(s)", chats.size());
        eventPublisher.publishEvent(new GroupMetadataEvent(ChatIdentities.SOCKET, chats));
    }

    private boolean isValidToken(String token) {
        String expected = properties.getChannels().getSocket().getToken();
        if (token == null || expected == null || expected.isBlank()) {
            return false;
        }
        return MessageDigest.isEqual(token.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8));
    }

    private String extractToken(WebSocketSession session) {
        String query = session.getHandshakeInfo().getUri().getQuery();
        if (query == null) {
            return null;
        }
        return UriComponentsBuilder.newInstance()
                .query(query)
                .build()
                .getQueryParams()
                .getFirst("token");
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }
}
