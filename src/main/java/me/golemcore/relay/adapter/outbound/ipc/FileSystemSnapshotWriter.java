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

package me.golemcore.relay.adapter.outbound.ipc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.relay.adapter.outbound.storage.PathSupport;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.SandboxSnapshotPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;

/**
 * Writes the read-only snapshots the sandbox sees next to its mailboxes. Each
 * file is replaced through a rename so the sandbox never reads a partial
 * snapshot.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FileSystemSnapshotWriter implements SandboxSnapshotPort {

    static final String TASKS_SNAPSHOT = "current_tasks.json";
    static final String GROUPS_SNAPSHOT = "available_groups.json";

    private final RelayProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public void writeTasksSnapshot(String groupFolder, List<Map<String, Object>> tasks) {
        write(groupFolder, TASKS_SNAPSHOT, tasks);
    }

    @Override
    public void writeGroupsSnapshot(String groupFolder, List<Map<String, Object>> groups) {
        write(groupFolder, GROUPS_SNAPSHOT, Map.of("groups", groups));
    }

    private void write(String groupFolder, String fileName, Object content) {
        Path ipcRoot = PathSupport.resolveHome(properties.getIpc().getDirectory());
        Path file = PathSupport.resolveWithin(ipcRoot, groupFolder, fileName);
        try {
            Files.createDirectories(file.getParent());
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(content);
            Path temp = file.resolveSibling(fileName + ".tmp");
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("[IPC] Wrote {} for {}", fileName, groupFolder);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + fileName, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }
}
