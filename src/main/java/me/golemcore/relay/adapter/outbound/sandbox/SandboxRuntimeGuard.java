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

package me.golemcore.relay.adapter.outbound.sandbox;

import me.golemcore.relay.adapter.outbound.process.ProcessResult;
import me.golemcore.relay.adapter.outbound.process.ProcessRunner;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Startup check that the sandbox runtime (for example a container daemon) is
 * reachable, starting it once if a start command is configured.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SandboxRuntimeGuard {

    private final ProcessRunner processRunner;
    private final RelayProperties properties;

    /**
     * @return true if no check is configured or the runtime answered
     */
    public boolean ensureRuntimeAvailable() {
        RelayProperties.SandboxProperties sandbox = properties.getSandbox();
        String check = sandbox.getRuntimeCheckCommand();
        if (check == null || check.isBlank()) {
            return true;
        }
        if (runCheck(check, sandbox.getRuntimeCheckTimeoutMs())) {
            log.info("[Sandbox] Runtime is available");
            return true;
        }
        String startCommand = sandbox.getRuntimeStartCommand();
        if (startCommand == null || startCommand.isBlank()) {
            return false;
        }
        log.info("[Sandbox] Runtime not responding, starting it");
        runCheck(startCommand, sandbox.getRuntimeCheckTimeoutMs());
        return runCheck(check, sandbox.getRuntimeCheckTimeoutMs());
    }

    private boolean runCheck(String command, long timeoutMs) {
        try {
            ProcessResult result = processRunner.run(command, null, null, Map.of(), timeoutMs);
            if (!result.isSuccess()) {
                log.warn("[Sandbox] '{}' failed (exit {}, timedOut={})", command, result.exitCode(),
                        result.timedOut());
            }
            return result.isSuccess();
        } catch (UncheckedIOException e) {
            log.warn("[Sandbox] '{}' could not be started: {}", command, e.getMessage());
            return false;
        }
    }
}
