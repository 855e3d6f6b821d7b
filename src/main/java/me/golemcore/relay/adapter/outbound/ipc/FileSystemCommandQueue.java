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
import me.golemcore.relay.domain.ipc.CommandEnvelope;
import me.golemcore.relay.domain.ipc.CommandResult;
import me.golemcore.relay.domain.ipc.IpcMailbox;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.CommandQueuePort;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

/**
 * Filesystem mailboxes shared with the sandbox.
 *
 * <pre>
 * &lt;ipc&gt;/&lt;group&gt;/messages/*.json   fire-and-forget commands
 * &lt;ipc&gt;/&lt;group&gt;/tasks/*.json      request/response commands
 * &lt;ipc&gt;/&lt;group&gt;/results/&lt;requestId&gt;.json
 * &lt;ipc&gt;/errors/&lt;group&gt;-&lt;file&gt;     quarantined commands
 * </pre>
 *
 * Files are written to a temporary name and renamed into place, so a reader
 * never sees a partial command. Only {@code .json} files are read.
 */
@Component
@Slf4j
public class FileSystemCommandQueue implements CommandQueuePort {

    static final String ERRORS_DIR = "errors";
    static final String RESULTS_DIR = "results";
    private static final String JSON_SUFFIX = ".json";
    private static final String TMP_SUFFIX = ".tmp";

    private final RelayProperties properties;
    private final ObjectMapper objectMapper;
    private final SecureRandom random = new SecureRandom();

    private Path ipcRoot;

    public FileSystemCommandQueue(RelayProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        this.ipcRoot = PathSupport.resolveHome(properties.getIpc().getDirectory());
        try {
            Files.createDirectories(ipcRoot.resolve(ERRORS_DIR));
            log.info("[IPC] Mailbox root: {}", ipcRoot);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create IPC directory " + ipcRoot, e);
        }
    }

    @Override
    public void enqueue(String sourceGroup, IpcMailbox mailbox, String payload) {
        String fileName = System.currentTimeMillis() + "-" + Integer.toString(random.nextInt(Integer.MAX_VALUE), 36)
                + JSON_SUFFIX;
        writeAtomically(PathSupport.resolveWithin(ipcRoot, sourceGroup, mailbox.directoryName(), fileName),
                payload);
    }

    @Override
    public List<String> listSources() {
        if (!Files.isDirectory(ipcRoot)) {
            return Collections.emptyList();
        }
        try (Stream<Path> children = Files.list(ipcRoot)) {
            return children
                    .filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .filter(name -> !ERRORS_DIR.equals(name))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list IPC sources", e);
        }
    }

    @Override
    public List<CommandEnvelope> dequeue(String sourceGroup, IpcMailbox mailbox) {
        Path dir = PathSupport.resolveWithin(ipcRoot, sourceGroup, mailbox.directoryName());
        if (!Files.isDirectory(dir)) {
            return Collections.emptyList();
        }
        List<Path> files;
        try (Stream<Path> children = Files.list(dir)) {
            files = children
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(JSON_SUFFIX))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dir, e);
        }

        List<CommandEnvelope> envelopes = new ArrayList<>();
        for (Path file : files) {
            try {
                String payload = Files.readString(file, StandardCharsets.UTF_8);
                envelopes.add(new CommandEnvelope(sourceGroup, mailbox, file.getFileName().toString(), payload));
            } catch (NoSuchFileException e) {
                log.debug("[IPC] {} vanished before it was read", file);
            } catch (IOException e) {
                log.warn("[IPC] Failed to read {}: {}", file, e.getMessage());
                quarantineUnreadable(new CommandEnvelope(sourceGroup, mailbox, file.getFileName().toString(), null),
                        e);
            }
        }
        return envelopes;
    }

    @Override
    public void acknowledge(CommandEnvelope envelope) {
        try {
            Files.deleteIfExists(locate(envelope));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to remove " + envelope.fileName(), e);
        }
    }

    @Override
    public void deadLetter(CommandEnvelope envelope, String reason) {
        Path target = PathSupport.resolveWithin(ipcRoot, ERRORS_DIR,
                envelope.sourceGroup() + "-" + envelope.fileName());
        try {
            Files.createDirectories(target.getParent());
            Files.move(locate(envelope), target, StandardCopyOption.REPLACE_EXISTING);
            log.warn("[IPC] Quarantined {} as {}: {}", envelope.fileName(), target.getFileName(), reason);
        } catch (NoSuchFileException e) {
            log.warn("[IPC] Cannot quarantine {}, file is gone", envelope.fileName());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to quarantine " + envelope.fileName(), e);
        }
    }

    @Override
    public void publishResult(String sourceGroup, CommandResult result) {
        String fileName = result.getRequestId().replaceAll("[^A-Za-z0-9._-]", "_") + JSON_SUFFIX;
        try {
            String json = objectMapper.writeValueAsString(result);
            writeAtomically(PathSupport.resolveWithin(ipcRoot, sourceGroup, RESULTS_DIR, fileName), json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize result " + result.getRequestId(), e);
        }
    }

    private void quarantineUnreadable(CommandEnvelope envelope, IOException cause) {
        String reason = cause instanceof CharacterCodingException ? "payload is not valid UTF-8"
                : "unreadable: " + cause.getMessage();
        try {
            deadLetter(envelope, reason);
        } catch (UncheckedIOException e) {
            log.error("[IPC] Failed to quarantine unreadable {}", envelope.fileName(), e);
        }
    }

    Path getIpcRoot() {
        return ipcRoot;
    }

    private Path locate(CommandEnvelope envelope) {
        return PathSupport.resolveWithin(ipcRoot, envelope.sourceGroup(), envelope.mailbox().directoryName(),
                envelope.fileName());
    }

    private void writeAtomically(Path target, String content) {
        Path tmp = target.resolveSibling(target.getFileName() + TMP_SUFFIX);
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + target, e);
        }
    }
}
