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

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * Create a scheduled task. {@code groupFolder} names the group the task runs
 * for and defaults to the source group. Any chat identity in the payload is
 * ignored; delivery goes to the target group's registered chat.
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class ScheduleTaskCommand extends IpcCommand {

    private String prompt;

    @JsonProperty("schedule_type")
    @JsonAlias("scheduleType")
    private String scheduleType;

    @JsonProperty("schedule_value")
    @JsonAlias("scheduleValue")
    private String scheduleValue;

    @JsonProperty("context_mode")
    @JsonAlias("contextMode")
    private String contextMode;

    @JsonAlias("group_folder")
    private String groupFolder;

    @Override
    public IpcMailbox mailbox() {
        return IpcMailbox.TASKS;
    }

    @Override
    public void validate() {
        require(prompt, "prompt", "schedule_task");
        require(scheduleType, "schedule_type", "schedule_task");
        require(scheduleValue, "schedule_value", "schedule_task");
    }
}
