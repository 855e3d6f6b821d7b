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
 * Agent request to modify the host, awaiting a human decision. Held in memory
 * only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HostModificationRequest {

    private String id;
    private String groupFolder;
    private String chatIdentity;
    private String summary;
    private String filePath;
    private Instant timestamp;
    private Status status;
    private String approvedBy;
    private String error;

    public enum Status {
        PENDING, APPROVED, DENIED, APPLIED, FAILED
    }
}
