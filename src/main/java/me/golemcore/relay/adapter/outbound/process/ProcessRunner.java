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

package me.golemcore.relay.adapter.outbound.process;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs shell commands with a hard timeout. Output streams are drained on
 * background threads so a chatty process cannot block on a full pipe.
 */
@Component
@Slf4j
public class ProcessRunner {

    private static final int MAX_OUTPUT_LENGTH = 1_000_000;
    private static final long OUTPUT_DRAIN_SECONDS = 2;

    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "process-output");
        t.setDaemon(true);
        return t;
    });

    /**
     * Run {@code command} through {@code /bin/sh -c}.
     *
     * @param command
     *            shell command line
     * @param stdin
     *            text written to the process's standard input, may be null
     * @param workDir
     *            working directory, null for the current one
     * @param environment
     *            extra environment variables
     * @param timeoutMs
     *            hard limit after which the process is killed
     * @throws UncheckedIOException
     *             if the process cannot be started
     */
    public ProcessResult run(String command, String stdin, Path workDir, Map<String, String> environment,
            long timeoutMs) {
        ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", command);
        if (workDir != null) {
            pb.directory(workDir.toFile());
        }
        pb.environment().putAll(environment);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start command: " + command, e);
        }

        Future<String> stdout = executor.submit(() -> drain(process.getInputStream()));
        Future<String> stderr = executor.submit(() -> drain(process.getErrorStream()));

        try (OutputStream in = process.getOutputStream()) {
            if (stdin != null) {
                in.write(stdin.getBytes(StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            log.debug("[Process] Could not write stdin: {}", e.getMessage());
        }

        try {
            boolean completed = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!completed) {
                process.destroyForcibly();
                log.warn("[Process] Command timed out after {}ms", timeoutMs);
                return new ProcessResult(-1, collect(stdout), collect(stderr), true);
            }
            return new ProcessResult(process.exitValue(), collect(stdout), collect(stderr), false);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return new ProcessResult(-1, "", "Interrupted", true);
        }
    }

    private String drain(InputStream stream) throws IOException {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            while (line != null) {
                if (output.length() < MAX_OUTPUT_LENGTH) {
                    output.append(line).append('\n');
                }
                line = reader.readLine();
            }
        }
        return output.toString();
    }

    private String collect(Future<String> output) throws InterruptedException {
        try {
            return output.get(OUTPUT_DRAIN_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            output.cancel(true);
            return "[Output read timeout]";
        } catch (ExecutionException e) {
            return "[Output read failed: " + e.getCause().getMessage() + "]";
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
