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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.relay.adapter.outbound.process.ProcessResult;
import me.golemcore.relay.adapter.outbound.process.ProcessRunner;
import me.golemcore.relay.adapter.outbound.storage.PathSupport;
import me.golemcore.relay.domain.model.AgentRequest;
import me.golemcore.relay.domain.model.AgentResponse;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.AgentRunnerPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Runs the agent sandbox as an external command.
 *
 * <p>
 * The request is written to the command's stdin as JSON. The response JSON is
 * read from stdout between {@value #OUTPUT_START} and {@value #OUTPUT_END};
 * without markers the last line that looks like a JSON object is used. The
 * command sees its group through {@code RELAY_GROUP_FOLDER},
 * {@code RELAY_GROUP_DIR} and {@code RELAY_IPC_DIR}.
 */
@Component
@Slf4j
public class ContainerAgentRunner implements AgentRunnerPort {

    static final String OUTPUT_START = "---RELAY_OUTPUT_START---";
    static final String OUTPUT_END = "---RELAY_OUTPUT_END---";
    private static final int MAX_ERROR_DETAIL = 200;

    private final ProcessRunner processRunner;
    private final ObjectMapper objectMapper;
    private final RelayProperties properties;

    public ContainerAgentRunner(ProcessRunner processRunner, ObjectMapper objectMapper, RelayProperties properties) {
        this.processRunner = processRunner;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public AgentResponse run(AgentRequest request) {
        RelayProperties.SandboxProperties sandbox = properties.getSandbox();
        if (sandbox.getCommand() == null || sandbox.getCommand().isBlank()) {
            return AgentResponse.failure("relay.sandbox.command is not configured");
        }

        String input;
        try {
            input = objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            return AgentResponse.failure("Failed to serialize request: " + e.getOriginalMessage());
        }

        long timeoutMs = request.getContainerConfig() != null && request.getContainerConfig().getTimeoutMs() != null
                ? request.getContainerConfig().getTimeoutMs()
                : sandbox.getTimeoutMs();
        Path groupDir = PathSupport.resolveWithin(PathSupport.resolveHome(properties.getGroups().getDirectory()),
                request.getGroupFolder());
        Path ipcDir = PathSupport.resolveWithin(PathSupport.resolveHome(properties.getIpc().getDirectory()),
                request.getGroupFolder());
        Map<String, String> env = Map.of(
                "RELAY_GROUP_FOLDER", request.getGroupFolder(),
                "RELAY_GROUP_DIR", groupDir.toString(),
                "RELAY_IPC_DIR", ipcDir.toString());

        long start = System.currentTimeMillis();
        ProcessResult result;
        try {
            result = processRunner.run(sandbox.getCommand(), input, null, env, timeoutMs);
        } catch (UncheckedIOException e) {
            log.error("[Sandbox] Failed to start sandbox for {}: {}", request.getGroupFolder(), e.getMessage());
            return AgentResponse.failure("Sandbox failed to start: " + e.getMessage());
        }
        long duration = System.currentTimeMillis() - start;

        if (result.timedOut()) {
            log.error("[Sandbox] Group {} timed out after {}ms", request.getGroupFolder(), timeoutMs);
            return AgentResponse.failure("Sandbox timed out after " + timeoutMs + "ms");
        }
        log.debug("[Sandbox] Group {} finished in {}ms with code {}", request.getGroupFolder(), duration,
                result.exitCode());
        return parseResponse(result);
    }

    AgentResponse parseResponse(ProcessResult result) {
        String json = extractJson(result.stdout());
        if (json != null) {
            try {
                return objectMapper.readValue(json, AgentResponse.class);
            } catch (JsonProcessingException e) {
                log.warn("[Sandbox] Unparseable sandbox output: {}", e.getOriginalMessage());
            }
        }
        if (result.exitCode() != 0) {
            return AgentResponse.failure("Sandbox exited with code " + result.exitCode() + ": "
                    + tail(result.stderr()));
        }
        return AgentResponse.failure("Sandbox produced no response");
    }

    static String extractJson(String stdout) {
        if (stdout == null || stdout.isBlank()) {
            return null;
        }
        int start = stdout.indexOf(OUTPUT_START);
        int end = stdout.indexOf(OUTPUT_END);
        if (start >= 0 && end > start) {
            return stdout.substring(start + OUTPUT_START.length(), end).trim();
        }
        String[] lines = stdout.split("\\r?\\n");
        for (int i = lines.length - 1; i >= 0; i--) {
            String line = lines[i].trim();
            if (line.startsWith("{") && line.endsWith("}")) {
                return line;
            }
        }
        return null;
    }

    private static String tail(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        return trimmed.length() <= MAX_ERROR_DETAIL ? trimmed : trimmed.substring(trimmed.length() - MAX_ERROR_DETAIL);
    }
}
