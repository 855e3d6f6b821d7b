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

import java.util.ArrayList;
import java.util.List;

/**
 * Per-group sandbox overrides: extra mounts and an invocation timeout.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContainerConfig {

    @Builder.Default
    private List<Mount> additionalMounts = new ArrayList<>();

    private Long timeoutMs;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Mount {
        private String hostPath;
        private String containerPath;
        private boolean readonly = true;
    }
}
