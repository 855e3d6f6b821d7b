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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.relay.domain.service.ChatIdentities;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.inbound.ChannelPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Outbound side of the messaging socket. One bridge process is connected at a
 * time; a new connection replaces the previous one.
 *
 * <p>
 * Replies are prefixed with the assistant name so the bridge's echo of our own
 * messages can be recognized and dropped on the way back in.
 */
@Component
@Slf4j
public class SocketChannelAdapter implements ChannelPort {

    static final int SOCKET_MAX_MESSAGE_LENGTH = 65_536;

    private static final String KEY_TYPE = "type";
    private static final String KEY_CHAT = "chat";

    private final ObjectMapper objectMapper;
    private final RelayProperties properties;
    private final AtomicReference<WebSocketSession> session = new AtomicReference<>();
    private volatile boolean running = false;

    public SocketChannelAdapter(ObjectMapper objectMapper, RelayProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public String getChannelType() {
        return ChatIdentities.SOCKET;
    }

    @Override
    public void start() {
        if (!properties.getChannels().getSocket().isEnabled()) {
            log.info("[Socket] Channel disabled");
            return;
        }
        running = true;
        log.info("[Socket] Listening at {}", properties.getChannels().getSocket().getPath());
    }

    @Override
    public void stop() {
        running = false;
        WebSocketSession current = session.getAndSet(null);
        if (current != null) {
            current.close().subscribe();
        }
        log.info("[Socket] Stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public boolean isConnected() {
        WebSocketSession current = session.get();
        return current != null && current.isOpen();
    }

    @Override
    public int getMaxMessageLength() {
        return SOCKET_MAX_MESSAGE_LENGTH;
    }

    @Override
    public CompletableFuture<Void> sendMessage(String chatIdentity, String content) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put(KEY_TYPE, "send");
        frame.put(KEY_CHAT, chatIdentity);
        frame.put("text", properties.getAssistantName() + ": " + content);
        return sendFrame(frame, true);
    }

    @Override
    public void setTyping(String chatIdentity, boolean typing) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put(KEY_TYPE, "presence");
        frame.put(KEY_CHAT, chatIdentity);
        frame.put("state", typing ? "composing" : "paused");
        sendFrame(frame, false);
    }

    @Override
    public void requestGroupSync() {
        sendFrame(Map.of(KEY_TYPE, "sync_groups"), false);
    }

    void attach(WebSocketSession newSession) {
        WebSocketSession previous = session.getAndSet(newSession);
        if (previous != null && previous != newSession && previous.isOpen()) {
            log.info("[Socket] Replacing previous bridge connection {}", previous.getId());
            previous.close().subscribe();
        }
    }

    void detach(WebSocketSession closedSession) {
        session.compareAndSet(closedSession, null);
    }

    /**
     * Sends one JSON frame. Message frames fail the returned future when no
     * bridge is connected so the caller can retry; presence and sync frames
     * are best effort.
     */
    private CompletableFuture<Void> sendFrame(Map<String, Object> frame, boolean required) {
        WebSocketSession current = session.get();
        if (current == null || !current.isOpen()) {
            if (required) {
                return CompletableFuture.failedFuture(new IllegalStateException("No socket bridge connected"));
            }
            log.debug("[Socket] No bridge connected, dropping {} frame", frame.get(KEY_TYPE));
            return CompletableFuture.completedFuture(null);
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<Void> result = new CompletableFuture<>();
        Mono<Void> sendMono = current.send(Mono.just(current.textMessage(json)));
        sendMono.subscribe(
                unused -> {
                },
                error -> {
                    log.warn("[Socket] Failed to send {} frame: {}", frame.get(KEY_TYPE), error.getMessage());
                    result.completeExceptionally(error);
                },
                () -> result.complete(null));
        return required ? result : CompletableFuture.completedFuture(null);
    }
}
