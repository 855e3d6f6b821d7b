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

package me.golemcore.relay.infrastructure.lifecycle;

import me.golemcore.relay.adapter.outbound.process.ProcessResult;
import me.golemcore.relay.adapter.outbound.process.ProcessRunner;
import me.golemcore.relay.domain.service.JvmExitService;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Terminates the relay on conditions it cannot recover from: the sandbox
 * runtime is unavailable, an enabled channel has no credentials, or a chat
 * adapter was logged out.
 *
 * <p>
 * Before exiting it logs a banner and, when
 * {@code relay.operator.notify-command} is set, runs that command with the
 * reason in {@code RELAY_FATAL_REASON}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FatalConditionHandler {

    public static final int STATUS_FAILURE = 1;
    public static final int STATUS_LOGGED_OUT = 0;
    private static final long NOTIFY_TIMEOUT_MS = 10_000;

    private final RelayProperties properties;
    private final ProcessRunner processRunner;
    private final JvmExitService jvmExitService;

    public void fatal(String reason, int status) {
        log.error("[Lifecycle] ================================================================");
        log.error("[Lifecycle] FATAL: {}", reason);
        log.error("[Lifecycle] The relay cannot continue and will exit with status {}", status);
        log.error("[Lifecycle] ================================================================");
        notifyOperator(reason);
        jvmExitService.exit(status);
    }

    private void notifyOperator(String reason) {
        String command = properties.getOperator().getNotifyCommand();
        if (command == null || command.isBlank()) {
            return;
        }
        try {
            ProcessResult result = processRunner.run(command, null, null, Map.of("RELAY_FATAL_REASON", reason),
                    NOTIFY_TIMEOUT_MS);
            if (!result.isSuccess()) {
                log.warn("[Lifecycle] Operator notification exited with {}: {}", result.exitCode(), result.stderr());
            }
        } catch (RuntimeException e) {
            log.warn("[Lifecycle] Operator notification failed: {}", e.getMessage());
        }
    }
}
