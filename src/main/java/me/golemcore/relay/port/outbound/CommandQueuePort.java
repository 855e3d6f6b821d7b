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

package me.golemcore.relay.port.outbound;

import me.golemcore.relay.domain.ipc.CommandEnvelope;
import me.golemcore.relay.domain.ipc.CommandResult;
import me.golemcore.relay.domain.ipc.IpcMailbox;

import java.util.List;

/**
 * Queue of commands written by sandboxed agents. Every source group owns one
 * queue per {@link IpcMailbox}; the source of a command is the queue it was
 * read from and cannot be claimed by the payload.
 */
public interface CommandQueuePort {

    /**
     * Place a command on a group's queue.
     */
    void enqueue(String sourceGroup, IpcMailbox mailbox, String payload);

    /**
     * Source groups that currently own a queue. The dead-letter area is never
     * listed.
     */
    List<String> listSources();

    /**
     * Pending commands of one queue in arrival order. Dequeued commands stay in
     * place until acknowledged or dead-lettered.
     */
    List<CommandEnvelope> dequeue(String sourceGroup, IpcMailbox mailbox);

    /**
     * Remove a command that has been handled.
     */
    void acknowledge(CommandEnvelope envelope);

    /**
     * Move a command that could not be handled to the dead-letter area, keeping
     * its payload for inspection.
     */
    void deadLetter(CommandEnvelope envelope, String reason);

    /**
     * Publish the outcome of a request/response command for the sandbox to
     * pick up.
     */
    void publishResult(String sourceGroup, CommandResult result);
}
