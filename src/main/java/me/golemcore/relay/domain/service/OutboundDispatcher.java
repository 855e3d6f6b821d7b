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

import me.golemcore.relay.domain.model.HostModificationRequest;
import me.golemcore.relay.port.inbound.ChannelPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Delivers text back through the channel that owns a chat identity.
 *
 * <p>
 * Channel failures are transient by nature: they are logged and reported as
 * {@code false}, never thrown, so no delivery loop dies because a platform is
 * unavailable.
 */
@Service
@Slf4j
public class OutboundDispatcher {

    private static final long SEND_TIMEOUT_SECONDS = 30;

    private final Map<String, ChannelPort> channels = new ConcurrentHashMap<>();

    public OutboundDispatcher(List<ChannelPort> channelPorts) {
        for (ChannelPort port : channelPorts) {
            channels.put(port.getChannelType(), port);
        }
    }

    public Optional<ChannelPort> channelFor(String chatIdentity) {
        return Optional.ofNullable(channels.get(ChatIdentities.channelOf(chatIdentity)));
    }

    /**
     * Send text, split to the channel's payload limit.
     *
     * @return true if every chunk was accepted by the channel
     */
    public boolean sendText(String chatIdentity, String text) {
        Optional<ChannelPort> channel = channelFor(chatIdentity);
        if (channel.isEmpty()) {
            log.warn("[Dispatch] No channel for {}", chatIdentity);
            return false;
        }
        if (text == null || text.isBlank()) {
            return true;
        }

        ChannelPort port = channel.get();
        List<String> chunks = MessageChunker.split(text, port.getMaxMessageLength());
        for (String chunk : chunks) {
            try {
                port.sendMessage(chatIdentity, chunk).get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("[Dispatch] Interrupted while sending to {}", chatIdentity);
                return false;
            } catch (ExecutionException | TimeoutException | RuntimeException e) {
                log.error("[Dispatch] Failed to send to {}: {}", chatIdentity, e.getMessage());
                return false;
            }
        }
        log.debug("[Dispatch] Sent {} chunk(s) to {}", chunks.size(), chatIdentity);
        return true;
    }

    public void setTyping(String chatIdentity, boolean typing) {
        Optional<ChannelPort> channel = channelFor(chatIdentity);
        if (channel.isEmpty()) {
            return;
        }
        try {
            channel.get().setTyping(chatIdentity, typing);
        } catch (RuntimeException e) {
            log.debug("[Dispatch] Typing update failed for {}: {}", chatIdentity, e.getMessage());
        }
    }

    public boolean sendApprovalPrompt(String chatIdentity, HostModificationRequest request, String plainTextPrompt) {
        Optional<ChannelPort> channel = channelFor(chatIdentity);
        if (channel.isEmpty()) {
            log.warn("[Dispatch] No channel for approval prompt to {}", chatIdentity);
            return false;
        }
        try {
            channel.get().sendApprovalPrompt(chatIdentity, request, plainTextPrompt)
                    .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.error("[Dispatch] Failed to send approval prompt to {}: {}", chatIdentity, e.getMessage());
            return sendText(chatIdentity, plainTextPrompt);
        }
    }

    /**
     * Ask every running channel to report its group names.
     */
    public void requestGroupSync() {
        for (ChannelPort port : channels.values()) {
            if (!port.isRunning()) {
                continue;
            }
            try {
                port.requestGroupSync();
            } catch (RuntimeException e) {
                log.warn("[Dispatch] Group sync request failed on {}: {}", port.getChannelType(), e.getMessage());
            }
        }
    }
}
