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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Data;

/**
 * Closed set of commands a sandboxed agent can place in its mailbox. The
 * {@code type} field selects the subtype; unknown types fail to parse.
 */
@Data
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SendMessageCommand.class, name = "message"),
        @JsonSubTypes.Type(value = TypingIndicatorCommand.class, name = "typing_indicator"),
        @JsonSubTypes.Type(value = ScheduleTaskCommand.class, name = "schedule_task"),
        @JsonSubTypes.Type(value = PauseTaskCommand.class, name = "pause_task"),
        @JsonSubTypes.Type(value = ResumeTaskCommand.class, name = "resume_task"),
        @JsonSubTypes.Type(value = CancelTaskCommand.class, name = "cancel_task"),
        @JsonSubTypes.Type(value = RegisterGroupCommand.class, name = "register_group"),
        @JsonSubTypes.Type(value = RefreshGroupsCommand.class, name = "refresh_groups"),
        @JsonSubTypes.Type(value = DirectMessageCommand.class, name = "direct_message")
})
public abstract class IpcCommand {

    private String requestId;

    /**
     * Mailbox this command must arrive through.
     */
    public abstract IpcMailbox mailbox();

    /**
     * Check required fields.
     *
     * @throws InvalidCommandException
     *             if a required field is missing
     */
    public abstract void validate();

    protected static void require(String value, String field, String type) {
        if (value == null || value.isBlank()) {
            throw new InvalidCommandException(type + ": missing required field '" + field + "'");
        }
    }
}
