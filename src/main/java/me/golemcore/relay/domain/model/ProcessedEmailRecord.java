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
 * Dedup record for a polled email. {@code replyBody} holds the agent output
 * once produced so a failed reply can be re-sent without another agent turn.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessedEmailRecord {

    private String id;
    private String threadId;
    private String sender;
    private String subject;
    private Instant processedAt;
    private boolean responded;
    private String replyBody;
}
