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

import java.util.List;
import java.util.Optional;

/**
 * Per-group workspace directories shared with the agent sandbox. Each group
 * folder holds the agent's instructions file and any plan artifacts the agent
 * leaves for the host.
 */
public interface GroupWorkspacePort {

    /**
     * Create the group's directory if it does not exist yet.
     */
    void ensureGroupDirectory(String folder);

    /**
     * Write a file only if it is not already present.
     *
     * @return true if the file was created
     */
    boolean writeFileIfAbsent(String folder, String fileName, String content);

    List<String> listGroupFolders();

    boolean exists(String folder, String fileName);

    Optional<String> readFile(String folder, String fileName);

    /**
     * Rename a file within the group's directory.
     *
     * @return true if the source existed and was moved
     */
    boolean renameFile(String folder, String fromName, String toName);

    /**
     * Absolute location of a file, for display and for handing to external
     * tools.
     */
    String describePath(String folder, String fileName);
}
