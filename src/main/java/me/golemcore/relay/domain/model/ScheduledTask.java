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

package me.golemcore.relay.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Locale;

/**
 * A prompt the agent should run on a schedule on behalf of a group. Created
 * through the IPC mailbox and consumed by the task scheduler loop.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledTask {

    private String id;
    private String groupFolder;
    private String chatIdentity;
    private String prompt;
    private ScheduleType scheduleType;
    private String scheduleValue;
    private ContextMode contextMode;
    private Instant nextRun;
    private Status status;
    private Instant createdAt;
    private Instant lastRun;
    private String lastResult;

    public enum ScheduleType {
        CRON, INTERVAL, ONCE;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static ScheduleType fromWireName(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public enum ContextMode {
        GROUP, ISOLATED;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        /**
         * Unknown or missing values fall back to {@link #ISOLATED}.
         */
        @JsonCreator
        public static ContextMode fromWireName(String value) {
            if (value != null && "group".equalsIgnoreCase(value.trim())) {
                return GROUP;
            }
            return ISOLATED;
        }
    }

    public enum Status {
        ACTIVE, PAUSED, COMPLETED;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Status fromWireName(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }
}
