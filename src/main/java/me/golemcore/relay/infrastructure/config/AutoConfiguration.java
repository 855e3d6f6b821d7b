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


package me.golemcore.relay.infrastructure.config;

import me.golemcore.relay.adapter.outbound.sandbox.SandboxRuntimeGuard;
import me.golemcore.relay.domain.service.GroupMetadataService;
import me.golemcore.relay.infrastructure.lifecycle.FatalConditionHandler;
import me.golemcore.relay.port.inbound.ChannelPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Spring auto-configuration that verifies the environment and starts the relay
 * on application startup.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Logs startup information (privileged folder, storage and IPC
 * locations)</li>
 * <li>Makes sure the sandbox runtime is available, exiting otherwise</li>
 * <li>Refuses to start an enabled channel without credentials</li>
 * <li>Starts all enabled channels, then syncs group metadata if due</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final RelayProperties properties;
    private final List<ChannelPort> channelPorts;
    private final SandboxRuntimeGuard sandboxRuntimeGuard;
    private final FatalConditionHandler fatalConditionHandler;
    private final GroupMetadataService groupMetadataService;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Relay starting as '{}'...", properties.getAssistantName());
        log.info("Privileged group folder: {}", properties.getMainGroupFolder());
        log.info("Storage Path: {}", properties.getStorage().getBasePath());
        log.info("IPC Path: {}", properties.getIpc().getDirectory());

        if (!sandboxRuntimeGuard.ensureRuntimeAvailable()) {
            fatalConditionHandler.fatal("Sandbox runtime is not available and could not be started",
                    FatalConditionHandler.STATUS_FAILURE);
            return;
        }

        List<String> problems = findCredentialProblems();
        if (!problems.isEmpty()) {
            fatalConditionHandler.fatal(String.join("; ", problems), FatalConditionHandler.STATUS_FAILURE);
            return;
        }

        for (ChannelPort channel : channelPorts) {
            log.info("Starting channel: {}", channel.getChannelType());
            channel.start();
        }

        groupMetadataService.sync(false);
        log.info("GolemCore Relay started successfully");
    }

    List<String> findCredentialProblems() {
        RelayProperties.ChannelsProperties channels = properties.getChannels();
        List<String> problems = new ArrayList<>();
        if (channels.getTelegram().isEnabled() && isBlank(channels.getTelegram().getToken())) {
            problems.add("Telegram channel is enabled but relay.channels.telegram.token is not set");
        }
        if (channels.getSocket().isEnabled() && isBlank(channels.getSocket().getToken())) {
            problems.add("Socket channel is enabled but relay.channels.socket.token is not set");
        }
        RelayProperties.EmailProperties email = channels.getEmail();
        if (email.isEnabled() && (isBlank(email.getImap().getHost()) || isBlank(email.getSmtp().getHost()))) {
            problems.add("Email channel is enabled but relay.channels.email.imap.host or smtp.host is not set");
        }
        return problems;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
