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

package me.golemcore.relay.adapter.outbound.storage;

import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.GroupWorkspacePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Group workspaces on the local filesystem under {@code relay.groups.directory}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalGroupWorkspaceAdapter implements GroupWorkspacePort {

    private final RelayProperties properties;

    private Path groupsRoot;

    @PostConstruct
    public void init() {
        this.groupsRoot = PathSupport.resolveHome(properties.getGroups().getDirectory());
        try {
            Files.createDirectories(groupsRoot);
            log.info("[Groups] Group workspaces at: {}", groupsRoot);
        } catch (IOException e) {
            log.error("[Groups] Failed to create groups directory", e);
        }
    }

    @Override
    public void ensureGroupDirectory(String folder) {
        try {
            Files.createDirectories(PathSupport.resolveWithin(groupsRoot, folder));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create group directory: " + folder, e);
        }
    }

    @Override
    public boolean writeFileIfAbsent(String folder, String fileName, String content) {
        Path file = PathSupport.resolveWithin(groupsRoot, folder, fileName);
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, content, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + folder + "/" + fileName, e);
        }
    }

    @Override
    public List<String> listGroupFolders() {
        if (!Files.isDirectory(groupsRoot)) {
            return Collections.emptyList();
        }
        try (Stream<Path> children = Files.list(groupsRoot)) {
            return children
                    .filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list group folders", e);
        }
    }

    @Override
    public boolean exists(String folder, String fileName) {
        return Files.isRegularFile(PathSupport.resolveWithin(groupsRoot, folder, fileName));
    }

    @Override
    public Optional<String> readFile(String folder, String fileName) {
        Path file = PathSupport.resolveWithin(groupsRoot, folder, fileName);
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + folder + "/" + fileName, e);
        }
    }

    @Override
    public boolean renameFile(String folder, String fromName, String toName) {
        Path source = PathSupport.resolveWithin(groupsRoot, folder, fromName);
        Path target = PathSupport.resolveWithin(groupsRoot, folder, toName);
        try {
            Files.move(source, target);
            return true;
        } catch (NoSuchFileException e) {
            log.debug("[Groups] Nothing to rename: {}/{}", folder, fromName);
            return false;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to rename " + folder + "/" + fromName, e);
        }
    }

    @Override
    public String describePath(String folder, String fileName) {
        return PathSupport.resolveWithin(groupsRoot, folder, fileName).toString();
    }
}
