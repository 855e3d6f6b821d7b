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

package me.golemcore.relay.domain.ipc;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response to a request/response command, published under the source group's
 * {@code results/} directory keyed by request id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CommandResult {

    public static final String STATUS_OK = "ok";
    public static final String STATUS_REJECTED = "rejected";
    public static final String STATUS_ERROR = "error";

    private String requestId;
    private String status;
    private String message;
    private String taskId;

    public static CommandResult ok(String message) {
        return CommandResult.builder().status(STATUS_OK).message(message).build();
    }

    public static CommandResult rejected(String message) {
        return CommandResult.builder().status(STATUS_REJECTED).message(message).build();
    }

    public static CommandResult error(String message) {
        return CommandResult.builder().status(STATUS_ERROR).message(message).build();
    }
}
