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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Raw platform event published by a channel adapter before normalization.
 * Carries the flags the normalizer needs to drop echoes and broadcasts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChannelEvent {

    private String channelType;
    private String messageId;
    private String chatIdentity;
    private String chatName;
    private String sender;
    private String senderName;
    private String body;
    private Instant timestamp;
    private boolean fromSelf;
    private boolean fromBot;
    private boolean group;
}
