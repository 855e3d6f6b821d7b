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
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * Base for commands that act on an existing task.
 */
@Data
@EqualsAndHashCode(callSuper = true)
public abstract class TaskControlCommand extends IpcCommand {

    @JsonAlias("task_id")
    private String taskId;

    public abstract String typeName();

    @Override
    public IpcMailbox mailbox() {
        return IpcMailbox.TASKS;
    }

    @Override
    public void validate() {
        require(taskId, "taskId", typeName());
    }
}
