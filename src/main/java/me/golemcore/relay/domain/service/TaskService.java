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

import me.golemcore.relay.domain.model.ScheduledTask;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.StoragePort;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Scheduled tasks requested by agents. Tasks are persisted in
 * {@code tasks/tasks.json} via {@link StoragePort}.
 *
 * <p>
 * Schedule values by type:
 * <ul>
 * <li>cron - 5 or 6 field cron expression, evaluated in
 * {@code relay.timezone}</li>
 * <li>interval - positive number of milliseconds</li>
 * <li>once - ISO timestamp in the future; a timestamp without offset is read in
 * {@code relay.timezone}</li>
 * </ul>
 */
@Service
@Slf4j
public class TaskService {

    private static final String TASKS_DIR = "tasks";
    private static final String TASKS_FILE = "tasks.json";
    private static final int CRON_FIVE_FIELDS = 5;
    private static final int CRON_SIX_FIELDS = 6;
    private static final int ID_SUFFIX_LENGTH = 6;
    private static final String ID_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int MAX_RESULT_LENGTH = 2000;
    private static final TypeReference<List<ScheduledTask>> TASK_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final RelayProperties properties;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    private List<ScheduledTask> tasksCache;

    public TaskService(StoragePort storagePort, ObjectMapper objectMapper, RelayProperties properties,
            Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Validate the schedule, compute the first run and persist a new active
     * task.
     *
     * @throws IllegalArgumentException
     *             if the schedule value is invalid for its type
     */
    public synchronized ScheduledTask createTask(String groupFolder, String chatIdentity, String prompt,
            ScheduledTask.ScheduleType scheduleType, String scheduleValue, ScheduledTask.ContextMode contextMode) {
        Instant now = clock.instant();
        Instant nextRun = computeFirstRun(scheduleType, scheduleValue, now);

        ScheduledTask task = ScheduledTask.builder()
                .id("task-" + now.toEpochMilli() + "-" + randomSuffix())
                .groupFolder(groupFolder)
                .chatIdentity(chatIdentity)
                .prompt(prompt)
                .scheduleType(scheduleType)
                .scheduleValue(scheduleValue.trim())
                .contextMode(contextMode != null ? contextMode : ScheduledTask.ContextMode.ISOLATED)
                .nextRun(nextRun)
                .status(ScheduledTask.Status.ACTIVE)
                .createdAt(now)
                .build();

        List<ScheduledTask> tasks = cachedTasks();
        tasks.add(task);
        saveTasks(tasks);

        log.info("[Tasks] Created task {} for group {} ({} {}), next run {}",
                task.getId(), groupFolder, scheduleType.wireName(), scheduleValue, nextRun);
        return task;
    }

    /**
     * Snapshot of every task. Later changes are not reflected in the returned
     * list.
     */
    public synchronized List<ScheduledTask> getTasks() {
        return List.copyOf(cachedTasks());
    }

    public synchronized List<ScheduledTask> getTasksForGroup(String groupFolder) {
        return cachedTasks().stream()
                .filter(task -> groupFolder.equals(task.getGroupFolder()))
                .toList();
    }

    public synchronized Optional<ScheduledTask> getTask(String taskId) {
        return cachedTasks().stream()
                .filter(task -> task.getId().equals(taskId))
                .findFirst();
    }

    /**
     * Active tasks whose next run is due.
     */
    public synchronized List<ScheduledTask> getDueTasks() {
        Instant now = clock.instant();
        return cachedTasks().stream()
                .filter(task -> task.getStatus() == ScheduledTask.Status.ACTIVE)
                .filter(task -> task.getNextRun() != null && !task.getNextRun().isAfter(now))
                .toList();
    }

    public synchronized boolean updateStatus(String taskId, ScheduledTask.Status status) {
        Optional<ScheduledTask> task = getTask(taskId);
        if (task.isEmpty()) {
            return false;
        }
        task.get().setStatus(status);
        saveTasks(cachedTasks());
        log.info("[Tasks] Task {} is now {}", taskId, status.wireName());
        return true;
    }

    public synchronized boolean deleteTask(String taskId) {
        List<ScheduledTask> tasks = cachedTasks();
        boolean removed = tasks.removeIf(task -> task.getId().equals(taskId));
        if (removed) {
            saveTasks(tasks);
            log.info("[Tasks] Task {} cancelled", taskId);
        }
        return removed;
    }

    /**
     * Record a finished run and move the task to its next run. One-shot tasks
     * complete.
     */
    public synchronized void recordRun(String taskId, String result) {
        Optional<ScheduledTask> found = getTask(taskId);
        if (found.isEmpty()) {
            log.debug("[Tasks] Run recorded for removed task {}", taskId);
            return;
        }
        ScheduledTask task = found.get();
        Instant now = clock.instant();
        task.setLastRun(now);
        task.setLastResult(truncate(result));

        switch (task.getScheduleType()) {
        case CRON -> task.setNextRun(nextCronRun(normalizeCronExpression(task.getScheduleValue()), now));
        case INTERVAL -> task.setNextRun(now.plusMillis(parseInterval(task.getScheduleValue())));
        case ONCE -> {
            task.setNextRun(null);
            task.setStatus(ScheduledTask.Status.COMPLETED);
        }
        default -> throw new IllegalStateException("Unknown schedule type: " + task.getScheduleType());
        }
        saveTasks(cachedTasks());
    }

    Instant computeFirstRun(ScheduledTask.ScheduleType scheduleType, String scheduleValue, Instant now) {
        if (scheduleType == null) {
            throw new IllegalArgumentException("Schedule type is required");
        }
        if (scheduleValue == null || scheduleValue.isBlank()) {
            throw new IllegalArgumentException("Schedule value is required");
        }
        return switch (scheduleType) {
        case CRON -> {
            Instant next = nextCronRun(normalizeCronExpression(scheduleValue), now);
            if (next == null) {
                throw new IllegalArgumentException("Cron expression never fires: " + scheduleValue);
            }
            yield next;
        }
        case INTERVAL -> now.plusMillis(parseInterval(scheduleValue));
        case ONCE -> {
            Instant at = parseTimestamp(scheduleValue);
            if (!at.isAfter(now)) {
                throw new IllegalArgumentException("Timestamp is not in the future: " + scheduleValue);
            }
            yield at;
        }
        };
    }

    /**
     * Normalize a 5-field cron expression to Spring's 6-field format.
     *
     * @throws IllegalArgumentException
     *             if the cron expression is invalid
     */
    static String normalizeCronExpression(String input) {
        String trimmed = input.trim();
        String[] parts = trimmed.split("\\s+");

        String sixFieldCron;
        if (parts.length == CRON_FIVE_FIELDS) {
            sixFieldCron = "0 " + trimmed;
        } else if (parts.length == CRON_SIX_FIELDS) {
            sixFieldCron = trimmed;
        } else {
            throw new IllegalArgumentException("Invalid cron expression: expected 5 or 6 fields, got " + parts.length);
        }

        try {
            CronExpression.parse(sixFieldCron);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid cron expression '" + trimmed + "': " + e.getMessage(), e);
        }
        return sixFieldCron;
    }

    private Instant nextCronRun(String cronExpression, Instant after) {
        ZonedDateTime next = CronExpression.parse(cronExpression).next(after.atZone(zone()));
        return next != null ? next.toInstant() : null;
    }

    private long parseInterval(String value) {
        long millis;
        try {
            millis = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid interval: " + value, e);
        }
        if (millis <= 0) {
            throw new IllegalArgumentException("Interval must be positive: " + value);
        }
        return millis;
    }

    private Instant parseTimestamp(String value) {
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(value.trim(),
                    ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return zoned.toInstant();
            }
            return ((LocalDateTime) parsed).atZone(zone()).toInstant();
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid timestamp: " + value, e);
        }
    }

    private ZoneId zone() {
        return ZoneId.of(properties.getTimezone());
    }

    private String randomSuffix() {
        StringBuilder sb = new StringBuilder(ID_SUFFIX_LENGTH);
        for (int i = 0; i < ID_SUFFIX_LENGTH; i++) {
            sb.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return sb.toString();
    }

    private String truncate(String result) {
        if (result == null || result.length() <= MAX_RESULT_LENGTH) {
            return result;
        }
        return result.substring(0, MAX_RESULT_LENGTH);
    }

    private void saveTasks(List<ScheduledTask> tasks) {
        try {
            String json = objectMapper.writeValueAsString(tasks);
            storagePort.putTextAtomic(TASKS_DIR, TASKS_FILE, json).join();
            tasksCache = tasks;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize tasks", e);
        }
    }

    private List<ScheduledTask> cachedTasks() {
        if (tasksCache == null) {
            tasksCache = loadTasks();
        }
        return tasksCache;
    }

    private List<ScheduledTask> loadTasks() {
        try {
            String json = storagePort.getText(TASKS_DIR, TASKS_FILE).join();
            if (json != null && !json.isBlank()) {
                return new ArrayList<>(objectMapper.readValue(json, TASK_LIST_TYPE_REF));
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - intentionally catch all for fallback
            log.debug("[Tasks] No tasks found or failed to parse: {}", e.getMessage());
        }
        return new ArrayList<>();
    }
}
