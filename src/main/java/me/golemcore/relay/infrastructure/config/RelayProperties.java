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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the relay application.
 *
 * <p>
 * All relay configuration is organized under the {@code relay.*} prefix. This
 * class contains nested property classes for different subsystems:
 * <ul>
 * <li>{@link StorageProperties} - workspace state persistence</li>
 * <li>{@link GroupsProperties} - group workspaces and metadata sync</li>
 * <li>{@link RouterProperties} - message delivery loop</li>
 * <li>{@link IpcProperties} - sandbox command mailbox</li>
 * <li>{@link SandboxProperties} - agent sandbox process</li>
 * <li>{@link HostChangesProperties} - host modification approvals</li>
 * <li>{@link ChannelsProperties} - chat channels</li>
 * </ul>
 *
 * <p>
 * All intervals and timeouts are expressed in milliseconds.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "relay")
@Data
public class RelayProperties {

    private String assistantName = "Golem";
    private String mainGroupFolder = "main";
    private String timezone = "UTC";

    private StorageProperties storage = new StorageProperties();
    private GroupsProperties groups = new GroupsProperties();
    private RouterProperties router = new RouterProperties();
    private IpcProperties ipc = new IpcProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();
    private SandboxProperties sandbox = new SandboxProperties();
    private HostChangesProperties hostChanges = new HostChangesProperties();
    private ChannelsProperties channels = new ChannelsProperties();
    private OperatorProperties operator = new OperatorProperties();

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/relay/data";
    }

    @Data
    public static class GroupsProperties {
        private String directory = "${user.home}/.golemcore/relay/groups";
        private String instructionsFile = "AGENTS.md";
        private long syncIntervalMs = 86_400_000L;
    }

    @Data
    public static class RouterProperties {
        private long pollIntervalMs = 2000;
        private int batchSize = 100;
        private long typingRefreshIntervalMs = 4000;
    }

    @Data
    public static class IpcProperties {
        private String directory = "${user.home}/.golemcore/relay/ipc";
        private long pollIntervalMs = 1000;
    }

    @Data
    public static class SchedulerProperties {
        private boolean enabled = true;
        private long pollIntervalMs = 60_000L;
    }

    @Data
    public static class SandboxProperties {
        private String command = "";
        private long timeoutMs = 300_000L;
        private String runtimeCheckCommand = "";
        private String runtimeStartCommand = "";
        private long runtimeCheckTimeoutMs = 10_000L;
    }

    @Data
    public static class HostChangesProperties {
        private boolean enabled = true;
        private long scanIntervalMs = 5000;
        private String applyCommand = "";
        private long applyTimeoutMs = 300_000L;
    }

    @Data
    public static class ChannelsProperties {
        private TelegramProperties telegram = new TelegramProperties();
        private SocketProperties socket = new SocketProperties();
        private EmailProperties email = new EmailProperties();
    }

    @Data
    public static class TelegramProperties {
        private boolean enabled = false;
        private String token;
        private List<String> allowFrom = new ArrayList<>();
    }

    @Data
    public static class SocketProperties {
        private boolean enabled = false;
        private String token;
        private String path = "/ws/relay";
    }

    @Data
    public static class EmailProperties {
        private boolean enabled = false;
        private String triggerMode = "label";
        private String triggerValue = "golem";
        private String contextMode = "thread";
        private long pollIntervalMs = 60_000L;
        private String replyPrefix = "";
        private int maxResults = 10;
        private int maxBodyLength = 50_000;
        private MailServerProperties imap = new MailServerProperties();
        private MailServerProperties smtp = new MailServerProperties();
    }

    @Data
    public static class MailServerProperties {
        private String host = "";
        private int port;
        private String username = "";
        private String password = "";
        private String security = "ssl";
        private int connectTimeout = 10000;
        private int readTimeout = 30000;
    }

    @Data
    public static class OperatorProperties {
        private String notifyCommand = "";
    }
}
