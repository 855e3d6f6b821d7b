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

package me.golemcore.relay.domain.state;

import me.golemcore.relay.domain.model.MessageCursor;
import me.golemcore.relay.domain.model.RegisteredGroup;
import me.golemcore.relay.port.outbound.StoragePort;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Durable routing state shared by the router, the IPC bus and the channels:
 * registered groups keyed by chat identity, one session token per group
 * folder, the global delivery watermark and the per-chat position of the last
 * message answered by a successful agent turn.
 *
 * <p>
 * Every mutation is flushed to {@code state/} before the method returns.
 * Watermarks only move forward; an older position is ignored.
 */
@Component
@Slf4j
public class RouterState {

    static final String STATE_DIR = "state";
    static final String GROUPS_FILE = "registered_groups.json";
    static final String SESSIONS_FILE = "sessions.json";
    static final String WATERMARKS_FILE = "router_state.json";

    private static final TypeReference<LinkedHashMap<String, RegisteredGroup>> GROUPS_TYPE_REF = new TypeReference<>() {
    };
    private static final TypeReference<HashMap<String, String>> SESSIONS_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    private Map<String, RegisteredGroup> groups = new LinkedHashMap<>();
    private Map<String, String> sessions = new HashMap<>();
    private Watermarks watermarks = new Watermarks();

    public RouterState(StoragePort storagePort, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public synchronized void load() {
        groups = read(GROUPS_FILE, GROUPS_TYPE_REF, new LinkedHashMap<>());
        sessions = read(SESSIONS_FILE, SESSIONS_TYPE_REF, new HashMap<>());
        watermarks = read(WATERMARKS_FILE, new TypeReference<Watermarks>() {
        }, new Watermarks());
        if (watermarks.getLastAgentRuns() == null) {
            watermarks.setLastAgentRuns(new HashMap<>());
        }
        log.info("[State] Loaded {} registered groups, {} sessions", groups.size(), sessions.size());
    }

    // ==================== Registered groups ====================

    public synchronized Map<String, RegisteredGroup> getRegisteredGroups() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(groups));
    }

    public synchronized Optional<RegisteredGroup> findGroup(String chatIdentity) {
        return Optional.ofNullable(groups.get(chatIdentity));
    }

    public synchronized boolean isRegistered(String chatIdentity) {
        return groups.containsKey(chatIdentity);
    }

    /**
     * Chat identity of the group that owns {@code folder}.
     */
    public synchronized Optional<String> findIdentityByFolder(String folder) {
        return groups.entrySet().stream()
                .filter(entry -> folder.equals(entry.getValue().getFolder()))
                .map(Map.Entry::getKey)
                .findFirst();
    }

    public synchronized void registerGroup(String chatIdentity, RegisteredGroup group) {
        groups.put(chatIdentity, group);
        write(GROUPS_FILE, groups);
        log.info("[State] Group registered: identity={}, name={}, folder={}",
                chatIdentity, group.getName(), group.getFolder());
    }

    // ==================== Sessions ====================

    public synchronized Optional<String> getSession(String folder) {
        return Optional.ofNullable(sessions.get(folder));
    }

    public synchronized void setSession(String folder, String sessionToken) {
        if (sessionToken == null || sessionToken.equals(sessions.get(folder))) {
            return;
        }
        sessions.put(folder, sessionToken);
        write(SESSIONS_FILE, sessions);
    }

    // ==================== Watermarks ====================

    /**
     * Position of the last message the router decided, or null before the first
     * one.
     */
    public synchronized MessageCursor getLastDelivered() {
        return watermarks.getLastDelivered();
    }

    /**
     * Move the global watermark forward. Returns false if {@code cursor} does not
     * sort after the current value.
     */
    public synchronized boolean advanceLastDelivered(MessageCursor cursor) {
        MessageCursor current = watermarks.getLastDelivered();
        if (cursor == null || (current != null && !current.precedes(cursor))) {
            return false;
        }
        watermarks.setLastDelivered(cursor);
        write(WATERMARKS_FILE, watermarks);
        return true;
    }

    public synchronized Optional<MessageCursor> getLastAgentRun(String chatIdentity) {
        return Optional.ofNullable(watermarks.getLastAgentRuns().get(chatIdentity));
    }

    public synchronized boolean advanceLastAgentRun(String chatIdentity, MessageCursor cursor) {
        MessageCursor current = watermarks.getLastAgentRuns().get(chatIdentity);
        if (cursor == null || (current != null && !current.precedes(cursor))) {
            return false;
        }
        watermarks.getLastAgentRuns().put(chatIdentity, cursor);
        write(WATERMARKS_FILE, watermarks);
        return true;
    }

    private <T> T read(String file, TypeReference<T> type, T fallback) {
        try {
            String json = storagePort.getText(STATE_DIR, file).join();
            if (json != null && !json.isBlank()) {
                return objectMapper.readValue(json, type);
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - start from empty state on unreadable file
            log.warn("[State] Failed to read {}: {}", file, e.getMessage());
        }
        return fallback;
    }

    private void write(String file, Object value) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
            storagePort.putTextAtomic(STATE_DIR, file, json).join();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize " + file, e);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class Watermarks {
        private MessageCursor lastDelivered;
        private Map<String, MessageCursor> lastAgentRuns = new HashMap<>();
    }
}
