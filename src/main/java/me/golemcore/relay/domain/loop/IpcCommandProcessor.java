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

package me.golemcore.relay.domain.loop;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.relay.domain.ipc.CommandEnvelope;
import me.golemcore.relay.domain.ipc.CommandResult;
import me.golemcore.relay.domain.ipc.DirectMessageCommand;
import me.golemcore.relay.domain.ipc.InvalidCommandException;
import me.golemcore.relay.domain.ipc.IpcCommand;
import me.golemcore.relay.domain.ipc.IpcMailbox;
import me.golemcore.relay.domain.ipc.PauseTaskCommand;
import me.golemcore.relay.domain.ipc.RefreshGroupsCommand;
import me.golemcore.relay.domain.ipc.RegisterGroupCommand;
import me.golemcore.relay.domain.ipc.ResumeTaskCommand;
import me.golemcore.relay.domain.ipc.ScheduleTaskCommand;
import me.golemcore.relay.domain.ipc.SendMessageCommand;
import me.golemcore.relay.domain.ipc.TaskControlCommand;
import me.golemcore.relay.domain.ipc.TypingIndicatorCommand;
import me.golemcore.relay.domain.model.RegisteredGroup;
import me.golemcore.relay.domain.model.ScheduledTask;
import me.golemcore.relay.domain.service.AgentInvoker;
import me.golemcore.relay.domain.service.AuthorizationService;
import me.golemcore.relay.domain.service.ChatIdentities;
import me.golemcore.relay.domain.service.GroupMetadataService;
import me.golemcore.relay.domain.service.GroupRegistrationService;
import me.golemcore.relay.domain.service.OutboundDispatcher;
import me.golemcore.relay.domain.service.TaskService;
import me.golemcore.relay.domain.service.TypingIndicatorService;
import me.golemcore.relay.domain.state.RouterState;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.CommandQueuePort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drains the per-group IPC mailboxes.
 *
 * <p>
 * The source of every command is the group whose mailbox it was read from;
 * nothing in the payload can change it. A command may act on a target group
 * only when the source is the privileged group or the target is the source
 * itself. Outcomes per file:
 * <ul>
 * <li>executed - file removed, result {@code ok}</li>
 * <li>unauthorized - warning logged, file removed, result
 * {@code rejected}</li>
 * <li>malformed, unknown type or failing - file quarantined, result
 * {@code error}</li>
 * </ul>
 * Results are published only for commands that carry a {@code requestId}.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class IpcCommandProcessor {

    private final CommandQueuePort commandQueue;
    private final ObjectMapper objectMapper;
    private final AuthorizationService authorizationService;
    private final RouterState routerState;
    private final TaskService taskService;
    private final OutboundDispatcher dispatcher;
    private final TypingIndicatorService typingIndicatorService;
    private final GroupRegistrationService groupRegistrationService;
    private final GroupMetadataService groupMetadataService;
    private final AgentInvoker agentInvoker;
    private final RelayProperties properties;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;

    public IpcCommandProcessor(CommandQueuePort commandQueue, ObjectMapper objectMapper,
            AuthorizationService authorizationService, RouterState routerState, TaskService taskService,
            OutboundDispatcher dispatcher, TypingIndicatorService typingIndicatorService,
            GroupRegistrationService groupRegistrationService, GroupMetadataService groupMetadataService,
            AgentInvoker agentInvoker, RelayProperties properties) {
        this.commandQueue = commandQueue;
        this.objectMapper = objectMapper;
        this.authorizationService = authorizationService;
        this.routerState = routerState;
        this.taskService = taskService;
        this.dispatcher = dispatcher;
        this.typingIndicatorService = typingIndicatorService;
        this.groupRegistrationService = groupRegistrationService;
        this.groupMetadataService = groupMetadataService;
        this.agentInvoker = agentInvoker;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        long interval = properties.getIpc().getPollIntervalMs();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ipc-command-processor");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::tick, interval, interval, TimeUnit.MILLISECONDS);
        log.info("[IPC] Watching mailboxes every {}ms", interval);
    }

    @PreDestroy
    public void shutdown() {
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[IPC] Shut down");
    }

    private void tick() {
        if (!executing.compareAndSet(false, true)) {
            return;
        }
        try {
            processAll();
        } catch (RuntimeException e) {
            log.error("[IPC] Mailbox scan failed", e);
        } finally {
            executing.set(false);
        }
    }

    /**
     * Process every pending command of every source group once.
     *
     * @return number of command files handled
     */
    public int processAll() {
        int handled = 0;
        for (String source : commandQueue.listSources()) {
            for (IpcMailbox mailbox : IpcMailbox.values()) {
                for (CommandEnvelope envelope : commandQueue.dequeue(source, mailbox)) {
                    handle(envelope);
                    handled++;
                }
            }
        }
        return handled;
    }

    void handle(CommandEnvelope envelope) {
        String source = envelope.sourceGroup();
        IpcCommand command;
        try {
            command = parse(envelope);
        } catch (InvalidCommandException e) {
            log.warn("[IPC] Quarantining {}/{}/{}: {}", source, envelope.mailbox().directoryName(),
                    envelope.fileName(), e.getMessage());
            quarantine(envelope, e.getMessage());
            publish(source, extractRequestId(envelope.payload()), CommandResult.error(e.getMessage()));
            return;
        }

        try {
            CommandResult result = execute(source, command);
            commandQueue.acknowledge(envelope);
            publish(source, command.getRequestId(), result);
        } catch (InvalidCommandException e) {
            log.warn("[IPC] Quarantining {}/{}: {}", source, envelope.fileName(), e.getMessage());
            quarantine(envelope, e.getMessage());
            publish(source, command.getRequestId(), CommandResult.error(e.getMessage()));
        } catch (RuntimeException e) {
            log.error("[IPC] Failed to process {}/{}", source, envelope.fileName(), e);
            quarantine(envelope, String.valueOf(e.getMessage()));
            publish(source, command.getRequestId(), CommandResult.error("Processing failed: " + e.getMessage()));
        }
    }

    private IpcCommand parse(CommandEnvelope envelope) {
        IpcCommand command;
        try {
            command = objectMapper.readValue(envelope.payload(), IpcCommand.class);
        } catch (JsonProcessingException e) {
            throw new InvalidCommandException("Unparseable command: " + e.getOriginalMessage(), e);
        }
        if (command == null) {
            throw new InvalidCommandException("Empty command");
        }
        if (command.mailbox() != envelope.mailbox()) {
            throw new InvalidCommandException(command.getClass().getSimpleName() + " is not accepted in "
                    + envelope.mailbox().directoryName() + "/");
        }
        command.validate();
        return command;
    }

    private CommandResult execute(String source, IpcCommand command) {
        if (command instanceof SendMessageCommand message) {
            return sendMessage(source, message);
        }
        if (command instanceof TypingIndicatorCommand typing) {
            return showTyping(source, typing);
        }
        if (command instanceof ScheduleTaskCommand schedule) {
            return scheduleTask(source, schedule);
        }
        if (command instanceof TaskControlCommand control) {
            return controlTask(source, control);
        }
        if (command instanceof RegisterGroupCommand register) {
            return registerGroup(source, register);
        }
        if (command instanceof RefreshGroupsCommand) {
            return refreshGroups(source);
        }
        if (command instanceof DirectMessageCommand direct) {
            return sendDirectMessage(source, direct);
        }
        throw new InvalidCommandException("Unsupported command " + command.getClass().getSimpleName());
    }

    private CommandResult sendMessage(String source, SendMessageCommand command) {
        if (!authorizationService.canAddressChat(source, command.getChatJid())) {
            return reject(source, "message", "chat " + command.getChatJid());
        }
        boolean sent = dispatcher.sendText(command.getChatJid(), command.getText());
        log.info("[IPC] Message from {} to {} {}", source, command.getChatJid(), sent ? "sent" : "failed");
        return sent ? CommandResult.ok("Message sent") : CommandResult.error("Delivery failed");
    }

    private CommandResult showTyping(String source, TypingIndicatorCommand command) {
        if (!authorizationService.canAddressChat(source, command.getChatJid())) {
            return reject(source, "typing_indicator", "chat " + command.getChatJid());
        }
        typingIndicatorService.startFor(command.getChatJid(), command.durationMs());
        return CommandResult.ok("Typing for " + command.durationMs() + "ms");
    }

    private CommandResult scheduleTask(String source, ScheduleTaskCommand command) {
        String target = command.getGroupFolder() != null && !command.getGroupFolder().isBlank()
                ? command.getGroupFolder()
                : source;
        if (!authorizationService.canActOn(source, target)) {
            return reject(source, "schedule_task", "group " + target);
        }
        Optional<String> chatIdentity = routerState.findIdentityByFolder(target);
        if (chatIdentity.isEmpty()) {
            log.warn("[IPC] schedule_task from {}: target group {} is not registered", source, target);
            return CommandResult.rejected("Target group not registered: " + target);
        }

        ScheduledTask task;
        try {
            ScheduledTask.ScheduleType type = ScheduledTask.ScheduleType.fromWireName(command.getScheduleType());
            task = taskService.createTask(target, chatIdentity.get(), command.getPrompt(), type,
                    command.getScheduleValue(), ScheduledTask.ContextMode.fromWireName(command.getContextMode()));
        } catch (IllegalArgumentException e) {
            throw new InvalidCommandException("schedule_task: " + e.getMessage(), e);
        }
        agentInvoker.writeTasksSnapshot(source);

        CommandResult result = CommandResult.ok("Task scheduled, next run " + task.getNextRun());
        result.setTaskId(task.getId());
        return result;
    }

    private CommandResult controlTask(String source, TaskControlCommand command) {
        String type = command.typeName();
        Optional<ScheduledTask> task = taskService.getTask(command.getTaskId());
        if (task.isEmpty()) {
            log.warn("[IPC] {} from {}: task {} not found", type, source, command.getTaskId());
            return CommandResult.error("Task not found: " + command.getTaskId());
        }
        if (!authorizationService.canActOn(source, task.get().getGroupFolder())) {
            return reject(source, type, "task " + command.getTaskId());
        }

        if (command instanceof PauseTaskCommand) {
            taskService.updateStatus(command.getTaskId(), ScheduledTask.Status.PAUSED);
        } else if (command instanceof ResumeTaskCommand) {
            taskService.updateStatus(command.getTaskId(), ScheduledTask.Status.ACTIVE);
        } else {
            taskService.deleteTask(command.getTaskId());
        }
        agentInvoker.writeTasksSnapshot(source);

        CommandResult result = CommandResult.ok(type + " applied");
        result.setTaskId(command.getTaskId());
        return result;
    }

    private CommandResult registerGroup(String source, RegisterGroupCommand command) {
        if (!authorizationService.isPrivileged(source)) {
            return reject(source, "register_group", "chat " + command.getJid());
        }
        RegisteredGroup group = RegisteredGroup.builder()
                .name(command.getName())
                .folder(command.getFolder())
                .trigger(command.getTrigger())
                .containerConfig(command.getContainerConfig())
                .build();
        try {
            groupRegistrationService.register(command.getJid(), group);
        } catch (IllegalArgumentException e) {
            throw new InvalidCommandException("register_group: " + e.getMessage(), e);
        }
        agentInvoker.writeGroupsSnapshot(source);
        return CommandResult.ok("Registered " + command.getJid() + " as " + command.getFolder());
    }

    private CommandResult refreshGroups(String source) {
        if (!authorizationService.isPrivileged(source)) {
            return reject(source, "refresh_groups", "all groups");
        }
        groupMetadataService.sync(true);
        agentInvoker.writeGroupsSnapshot(source);
        return CommandResult.ok("Group metadata refreshed");
    }

    private CommandResult sendDirectMessage(String source, DirectMessageCommand command) {
        if (!authorizationService.isPrivileged(source)) {
            return reject(source, "direct_message", "user " + command.getUserId());
        }
        String channel = command.getChannel() != null
                ? command.getChannel().trim().toLowerCase(Locale.ROOT)
                : ChatIdentities.TELEGRAM;
        String identity = switch (channel) {
        case ChatIdentities.TELEGRAM -> ChatIdentities.telegram(command.getUserId());
        case ChatIdentities.EMAIL -> ChatIdentities.email(command.getUserId());
        case ChatIdentities.SOCKET -> command.getUserId();
        default -> throw new InvalidCommandException("direct_message: unknown channel '" + channel + "'");
        };
        if (dispatcher.channelFor(identity).isEmpty()) {
            return CommandResult.error("Channel not available: " + channel);
        }
        boolean sent = dispatcher.sendText(identity, command.getText());
        return sent ? CommandResult.ok("Direct message sent") : CommandResult.error("Delivery failed");
    }

    private CommandResult reject(String source, String type, String target) {
        log.warn("[IPC] Unauthorized {} from group {} targeting {}", type, source, target);
        return CommandResult.rejected("Not authorized");
    }

    private void quarantine(CommandEnvelope envelope, String reason) {
        try {
            commandQueue.deadLetter(envelope, reason);
        } catch (RuntimeException e) {
            log.error("[IPC] Failed to quarantine {}/{}", envelope.sourceGroup(), envelope.fileName(), e);
        }
    }

    private void publish(String source, String requestId, CommandResult result) {
        if (requestId == null || requestId.isBlank()) {
            return;
        }
        result.setRequestId(requestId);
        try {
            commandQueue.publishResult(source, result);
        } catch (RuntimeException e) {
            log.error("[IPC] Failed to publish result {} for {}", requestId, source, e);
        }
    }

    private String extractRequestId(String payload) {
        try {
            JsonNode node = objectMapper.readTree(payload);
            JsonNode requestId = node != null ? node.get("requestId") : null;
            return requestId != null && requestId.isTextual() ? requestId.asText() : null;
        } catch (JsonProcessingException e) {
            log.debug("[IPC] No request id recoverable from payload: {}", e.getOriginalMessage());
            return null;
        }
    }
}
