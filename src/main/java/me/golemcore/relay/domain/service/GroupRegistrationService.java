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

package me.golemcore.relay.domain.service;

import me.golemcore.relay.domain.model.RegisteredGroup;
import me.golemcore.relay.domain.state.RouterState;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.GroupWorkspacePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.regex.Pattern;

/**
 * Enrolls chats as groups and prepares their workspaces.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GroupRegistrationService {

    private static final Pattern FOLDER_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._@-]{0,127}");
    // IPC quarantine directory, a sibling of the group mailboxes
    private static final String RESERVED_FOLDER = "errors";

    private final RouterState routerState;
    private final GroupWorkspacePort groupWorkspace;
    private final RelayProperties properties;
    private final Clock clock;

    public static boolean isValidFolder(String folder) {
        return folder != null && FOLDER_PATTERN.matcher(folder).matches() && !folder.contains("..")
                && !RESERVED_FOLDER.equalsIgnoreCase(folder);
    }

    /**
     * Register (or re-register) a chat under the given group definition.
     *
     * @throws IllegalArgumentException
     *             if the folder name is not a safe directory name
     */
    public RegisteredGroup register(String chatIdentity, RegisteredGroup group) {
        if (!isValidFolder(group.getFolder())) {
            throw new IllegalArgumentException("Invalid group folder: " + group.getFolder());
        }
        if (group.getAddedAt() == null) {
            group.setAddedAt(clock.instant());
        }
        groupWorkspace.ensureGroupDirectory(group.getFolder());
        routerState.registerGroup(chatIdentity, group);
        return group;
    }

    /**
     * Auto-register a one-to-one chat on first contact. Direct chats respond to
     * every message. Returns the existing group when already registered.
     */
    public RegisteredGroup registerDirectChat(String chatIdentity, String displayName, String folder) {
        return routerState.findGroup(chatIdentity).orElseGet(() -> {
            RegisteredGroup group = register(chatIdentity, RegisteredGroup.builder()
                    .name(displayName)
                    .folder(folder)
                    .trigger("")
                    .build());
            seedInstructions(folder, "# Direct chat with " + displayName + "\n\n"
                    + "You are chatting one-on-one with " + displayName + ". "
                    + "Every message they send reaches you; no trigger word is needed.\n");
            log.info("[Groups] Auto-registered direct chat {} as {}", chatIdentity, folder);
            return group;
        });
    }

    /**
     * Prepare a workspace for a group that lives only for one invocation.
     */
    public void prepareEphemeralWorkspace(String folder, String instructions) {
        if (!isValidFolder(folder)) {
            throw new IllegalArgumentException("Invalid group folder: " + folder);
        }
        groupWorkspace.ensureGroupDirectory(folder);
        seedInstructions(folder, instructions);
    }

    private void seedInstructions(String folder, String instructions) {
        String fileName = properties.getGroups().getInstructionsFile();
        if (groupWorkspace.writeFileIfAbsent(folder, fileName, instructions)) {
            log.debug("[Groups] Seeded {} for {}", fileName, folder);
        }
    }
}
