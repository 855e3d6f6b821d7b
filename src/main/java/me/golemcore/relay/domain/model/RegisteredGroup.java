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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A chat enrolled to receive agent invocations. Keyed by chat identity in the
 * router state; the folder names the group's workspace and IPC mailbox.
 *
 * <p>
 * An empty trigger makes the group respond to every message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisteredGroup {

    private String name;
    private String folder;
    private String trigger;
    private Instant addedAt;
    private ContainerConfig containerConfig;

    @JsonIgnore
    public boolean isAutoRespond() {
        return trigger == null || trigger.isEmpty();
    }
}
