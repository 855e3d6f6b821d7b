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
import me.golemcore.relay.adapter.outbound.storage.PathSupport;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.HostChangeApplierPort;
import me.golemcore.relay.port.outbound.HostChangeApplyException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Applies approved host change plans with {@code relay.host-changes.apply-command}.
 * The plan is passed on stdin; stdout is the result shown to the chat.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProcessHostChangeApplier implements HostChangeApplierPort {

    private final ProcessRunner processRunner;
    private final RelayProperties properties;

    @Override
    public String apply(String groupFolder, String planContent) {
        RelayProperties.HostChangesProperties config = properties.getHostChanges();
        if (config.getApplyCommand() == null || config.getApplyCommand().isBlank()) {
            throw new HostChangeApplyException("relay.host-changes.apply-command is not configured");
        }
        Path groupDir = PathSupport.resolveWithin(PathSupport.resolveHome(properties.getGroups().getDirectory()),
                groupFolder);

        ProcessResult result;
        try {
            result = processRunner.run(config.getApplyCommand(), planContent, null,
                    Map.of("RELAY_GROUP_FOLDER", groupFolder, "RELAY_GROUP_DIR", groupDir.toString()),
                    config.getApplyTimeoutMs());
        } catch (UncheckedIOException e) {
            throw new HostChangeApplyException("Apply command failed to start", e);
        }
        if (result.timedOut()) {
            throw new HostChangeApplyException("Timed out after " + config.getApplyTimeoutMs() + "ms");
        }
        if (result.exitCode() != 0) {
            String detail = result.stderr().isBlank() ? result.stdout() : result.stderr();
            throw new HostChangeApplyException("Exit code " + result.exitCode() + ": " + detail.trim());
        }
        log.info("[HostChanges] Apply command finished for {}", groupFolder);
        return result.stdout().trim();
    }
}
