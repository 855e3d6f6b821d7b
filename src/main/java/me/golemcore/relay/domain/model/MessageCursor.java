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

package me.golemcore.relay.domain.model;

import java.time.Instant;
import java.util.Comparator;

/**
 * Position of a stored message in delivery order: timestamp, then message id,
 * then chat identity. Channel timestamps are second-granular, so the timestamp
 * alone does not identify a position.
 *
 * @param timestamp
 *            message timestamp
 * @param messageId
 *            message id, unique per chat
 * @param chatIdentity
 *            owning chat
 */
public record MessageCursor(Instant timestamp, String messageId, String chatIdentity) {

    private static final Comparator<MessageCursor> POSITION_ORDER = Comparator
            .comparing(MessageCursor::timestamp)
            .thenComparing(MessageCursor::messageId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(MessageCursor::chatIdentity, Comparator.nullsFirst(Comparator.naturalOrder()));

    /**
     * Delivery order of stored messages.
     */
    public static final Comparator<InboundMessage> MESSAGE_ORDER = Comparator.comparing(MessageCursor::of,
            POSITION_ORDER);

    public static MessageCursor of(InboundMessage message) {
        return new MessageCursor(message.getTimestamp(), message.getId(), message.getChatIdentity());
    }

    /**
     * @return true if {@code message} sorts strictly after this position
     */
    public boolean precedes(InboundMessage message) {
        return POSITION_ORDER.compare(this, of(message)) < 0;
    }

    /**
     * @return true if {@code other} sorts strictly after this position
     */
    public boolean precedes(MessageCursor other) {
        return POSITION_ORDER.compare(this, other) < 0;
    }
}
