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

import java.util.concurrent.CompletableFuture;

/**
 * Port for the relay's own persistent state within the local workspace. Files
 * are organized by directory:
 * <ul>
 * <li>state/ - registered groups, sessions, watermarks</li>
 * <li>messages/ - chat metadata and per-chat history (JSONL)</li>
 * <li>tasks/ - scheduled tasks</li>
 * <li>email/ - processed email records</li>
 * </ul>
 */
public interface StoragePort {

    /**
     * Read text content from file. Completes with {@code null} when the file is
     * missing.
     *
     * @param directory
     *            subdirectory (e.g., "state", "messages")
     * @param path
     *            relative path within directory
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Append text to a file (JSONL history), creating it if needed.
     */
    CompletableFuture<Void> appendText(String directory, String path, String content);

    /**
     * Replace a file's content so that a crash leaves either the old or the new
     * version, never a mix. Used for every state file.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content);
}
