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

import me.golemcore.relay.domain.model.ChatMetadata;
import me.golemcore.relay.domain.model.InboundMessage;
import me.golemcore.relay.domain.model.MessageCursor;
import me.golemcore.relay.port.outbound.StoragePort;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Chat discovery metadata and per-chat message history.
 *
 * <p>
 * Metadata is kept for every chat seen, in {@code messages/chats.json}.
 * History is appended as JSONL to {@code messages/history/<chat>.jsonl} and
 * only for registered chats; message ids are unique per chat.
 */
@Service
@Slf4j
public class ChatHistoryService {

    private static final String MESSAGES_DIR = "messages";
    private static final String CHATS_FILE = "chats.json";
    private static final String HISTORY_PREFIX = "history/";
    private static final String HISTORY_SUFFIX = ".jsonl";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    private ChatDirectory directory;
    private final Map<String, List<InboundMessage>> historyCache = new HashMap<>();
    private final Map<String, Set<String>> seenIds = new HashMap<>();

    public ChatHistoryService(StoragePort storagePort, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
    }

    // ==================== Metadata ====================

    /**
     * Record that a chat was active at {@code timestamp}. The name is only
     * overwritten when a non-blank one is supplied.
     */
    public synchronized void recordChatMetadata(String identity, String name, Instant timestamp, boolean group) {
        ChatDirectory dir = getDirectory();
        ChatMetadata existing = dir.getChats().get(identity);
        ChatMetadata metadata = existing != null ? existing
                : ChatMetadata.builder().identity(identity).name(identity).build();
        if (name != null && !name.isBlank()) {
            metadata.setName(name);
        }
        if (timestamp != null && (metadata.getLastMessageTime() == null
                || timestamp.isAfter(metadata.getLastMessageTime()))) {
            metadata.setLastMessageTime(timestamp);
        }
        metadata.setGroup(metadata.isGroup() || group);
        dir.getChats().put(identity, metadata);
        saveDirectory();
    }

    /**
     * Apply group names reported by a channel. Unknown chats are added without a
     * last-message time.
     */
    public synchronized void updateChatNames(Collection<ChatMetadata> reported) {
        ChatDirectory dir = getDirectory();
        for (ChatMetadata chat : reported) {
            ChatMetadata existing = dir.getChats().get(chat.getIdentity());
            if (existing == null) {
                dir.getChats().put(chat.getIdentity(), ChatMetadata.builder()
                        .identity(chat.getIdentity())
                        .name(chat.getName())
                        .group(true)
                        .build());
            } else {
                existing.setName(chat.getName());
                existing.setGroup(true);
            }
        }
        saveDirectory();
    }

    public synchronized Optional<ChatMetadata> getChat(String identity) {
        return Optional.ofNullable(getDirectory().getChats().get(identity));
    }

    /**
     * Group chats, most recently active first.
     */
    public synchronized List<ChatMetadata> getGroupChats() {
        return getDirectory().getChats().values().stream()
                .filter(ChatMetadata::isGroup)
                .sorted(Comparator.comparing(ChatMetadata::getLastMessageTime,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    public synchronized Optional<Instant> getLastGroupSync() {
        return Optional.ofNullable(getDirectory().getLastGroupSync());
    }

    public synchronized void setLastGroupSync(Instant timestamp) {
        getDirectory().setLastGroupSync(timestamp);
        saveDirectory();
    }

    // ==================== History ====================

    /**
     * Append a message to its chat's history.
     *
     * @return false if a message with the same id was already stored
     */
    public synchronized boolean storeMessage(InboundMessage message) {
        String identity = message.getChatIdentity();
        List<InboundMessage> history = loadHistory(identity);
        Set<String> ids = seenIds.computeIfAbsent(identity, key -> new HashSet<>());
        if (message.getId() != null && !ids.add(message.getId())) {
            log.debug("[History] Duplicate message ignored: chat={}, id={}", identity, message.getId());
            return false;
        }
        try {
            String line = objectMapper.writeValueAsString(message) + "\n";
            storagePort.appendText(MESSAGES_DIR, historyPath(identity), line).join();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize message " + message.getId(), e);
        }
        history.add(message);
        return true;
    }

    /**
     * Messages after {@code since} across the given chats, in delivery order. A
     * null {@code since} starts from the beginning.
     */
    public synchronized List<InboundMessage> getNewMessages(Collection<String> identities, MessageCursor since,
            int limit) {
        List<InboundMessage> result = new ArrayList<>();
        for (String identity : identities) {
            for (InboundMessage message : loadHistory(identity)) {
                if (isAfter(message, since)) {
                    result.add(message);
                }
            }
        }
        result.sort(MessageCursor.MESSAGE_ORDER);
        if (result.size() > limit) {
            return new ArrayList<>(result.subList(0, limit));
        }
        return result;
    }

    /**
     * Every message of a chat after {@code since}, in delivery order. A null
     * {@code since} returns the whole history.
     */
    public synchronized List<InboundMessage> getMessagesSince(String identity, MessageCursor since) {
        return loadHistory(identity).stream()
                .filter(message -> isAfter(message, since))
                .sorted(MessageCursor.MESSAGE_ORDER)
                .toList();
    }

    private boolean isAfter(InboundMessage message, MessageCursor since) {
        return since == null || since.precedes(message);
    }

    private List<InboundMessage> loadHistory(String identity) {
        List<InboundMessage> cached = historyCache.get(identity);
        if (cached != null) {
            return cached;
        }
        List<InboundMessage> history = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        String content = storagePort.getText(MESSAGES_DIR, historyPath(identity)).join();
        if (content != null) {
            for (String line : content.split("\n")) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    InboundMessage message = objectMapper.readValue(line, InboundMessage.class);
                    if (message.getId() == null || ids.add(message.getId())) {
                        history.add(message);
                    }
                } catch (IOException e) { // NOSONAR - skip a torn trailing line
                    log.warn("[History] Skipping unreadable line for {}: {}", identity, e.getMessage());
                }
            }
        }
        historyCache.put(identity, history);
        seenIds.put(identity, ids);
        return history;
    }

    static String historyPath(String identity) {
        return HISTORY_PREFIX + identity.replaceAll("[^A-Za-z0-9._@-]", "_") + HISTORY_SUFFIX;
    }

    private ChatDirectory getDirectory() {
        if (directory == null) {
            directory = loadDirectory();
        }
        return directory;
    }

    private ChatDirectory loadDirectory() {
        try {
            String json = storagePort.getText(MESSAGES_DIR, CHATS_FILE).join();
            if (json != null && !json.isBlank()) {
                ChatDirectory loaded = objectMapper.readValue(json, new TypeReference<ChatDirectory>() {
                });
                if (loaded.getChats() == null) {
                    loaded.setChats(new LinkedHashMap<>());
                }
                return loaded;
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - start with an empty directory
            log.warn("[History] Failed to read chat directory: {}", e.getMessage());
        }
        return new ChatDirectory();
    }

    private void saveDirectory() {
        try {
            String json = objectMapper.writeValueAsString(directory);
            storagePort.putTextAtomic(MESSAGES_DIR, CHATS_FILE, json).join();
        } catch (Exception e) { // NOSONAR - metadata is advisory, keep routing on write failure
            log.error("[History] Failed to save chat directory", e);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class ChatDirectory {
        private Map<String, ChatMetadata> chats = new LinkedHashMap<>();
        private Instant lastGroupSync;
    }
}
