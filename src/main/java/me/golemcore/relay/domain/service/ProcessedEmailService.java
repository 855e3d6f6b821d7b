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

import me.golemcore.relay.domain.model.ProcessedEmailRecord;
import me.golemcore.relay.port.outbound.StoragePort;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Dedup records for polled emails, keyed by email id and persisted in
 * {@code email/processed.json}. A record is written before the agent runs and
 * flagged as responded only after the reply went out.
 */
@Service
@Slf4j
public class ProcessedEmailService {

    private static final String EMAIL_DIR = "email";
    private static final String PROCESSED_FILE = "processed.json";
    private static final TypeReference<LinkedHashMap<String, ProcessedEmailRecord>> RECORDS_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    private Map<String, ProcessedEmailRecord> records;

    public ProcessedEmailService(StoragePort storagePort, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
    }

    public synchronized Optional<ProcessedEmailRecord> find(String emailId) {
        return Optional.ofNullable(getRecords().get(emailId));
    }

    /**
     * Store the record unless one already exists for its id.
     *
     * @return true if the record was added
     */
    public synchronized boolean recordIfAbsent(ProcessedEmailRecord record) {
        if (getRecords().putIfAbsent(record.getId(), record) != null) {
            return false;
        }
        save();
        return true;
    }

    public synchronized void storeReply(String emailId, String replyBody) {
        ProcessedEmailRecord record = getRecords().get(emailId);
        if (record == null) {
            throw new IllegalStateException("No processed record for email " + emailId);
        }
        record.setReplyBody(replyBody);
        save();
    }

    public synchronized void markResponded(String emailId) {
        ProcessedEmailRecord record = getRecords().get(emailId);
        if (record == null) {
            throw new IllegalStateException("No processed record for email " + emailId);
        }
        record.setResponded(true);
        save();
        log.debug("[Email] Marked {} as responded", emailId);
    }

    private Map<String, ProcessedEmailRecord> getRecords() {
        if (records == null) {
            records = load();
        }
        return records;
    }

    private Map<String, ProcessedEmailRecord> load() {
        try {
            String json = storagePort.getText(EMAIL_DIR, PROCESSED_FILE).join();
            if (json != null && !json.isBlank()) {
                return objectMapper.readValue(json, RECORDS_TYPE_REF);
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - intentionally catch all for fallback
            log.warn("[Email] Failed to read processed records: {}", e.getMessage());
        }
        return new LinkedHashMap<>();
    }

    private void save() {
        try {
            String json = objectMapper.writeValueAsString(records);
            storagePort.putTextAtomic(EMAIL_DIR, PROCESSED_FILE, json).join();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize processed email records", e);
        }
    }
}
