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

package me.golemcore.relay.port.inbound;

import me.golemcore.relay.domain.model.HostModificationRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Bidirectional port for chat channels (messaging socket, Telegram, email).
 * Inbound traffic is published as
 * {@link me.golemcore.relay.domain.model.ChannelEvent}; this interface covers
 * lifecycle and the outbound side. All identities passed in are full chat
 * identities, prefixed where the channel uses a prefix.
 */
public interface ChannelPort {

    /**
     * Returns the channel type identifier (e.g., "telegram", "socket").
     */
    String getChannelType();

    void start();

    void stop();

    boolean isRunning();

    /**
     * Maximum number of characters the platform accepts in one message.
     */
    int getMaxMessageLength();

    /**
     * Sends one message. Callers split long text beforehand.
     */
    CompletableFuture<Void> sendMessage(String chatIdentity, String content);

    /**
     * Sets or clears the typing indicator. Channels without a stop primitive
     * ignore {@code typing=false} and let the indicator expire.
     */
    default void setTyping(String chatIdentity, boolean typing) {
        // Default no-op implementation
    }

    /**
     * Sends a host change approval prompt. Channels with interactive controls
     * override this; the default posts the plain-text prompt.
     */
    default CompletableFuture<Void> sendApprovalPrompt(String chatIdentity, HostModificationRequest request,
            String plainTextPrompt) {
        return sendMessage(chatIdentity, plainTextPrompt);
    }

    /**
     * Asks the platform to report group chat names. Answers arrive
     * asynchronously as
     * {@link me.golemcore.relay.domain.model.GroupMetadataEvent}.
     */
    default void requestGroupSync() {
        // Default no-op implementation
    }
}
