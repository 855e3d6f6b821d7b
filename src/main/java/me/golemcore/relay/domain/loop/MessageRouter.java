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

import me.golemcore.relay.domain.model.InboundMessage;
import me.golemcore.relay.domain.model.MessageCursor;
import me.golemcore.relay.domain.model.RegisteredGroup;
import me.golemcore.relay.domain.service.AgentInvoker;
import me.golemcore.relay.domain.service.AuthorizationService;
import me.golemcore.relay.domain.service.ChatHistoryService;
import me.golemcore.relay.domain.service.HostChangeApprovalService;
import me.golemcore.relay.domain.service.OutboundDispatcher;
import me.golemcore.relay.domain.service.PromptFormatter;
import me.golemcore.relay.domain.service.TypingIndicatorService;
import me.golemcore.relay.domain.state.RouterState;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * At-least-once delivery loop from chat history to the agent.
 *
 * <p>
 * Each cycle fetches stored messages of registered chats positioned after the
 * global watermark (see {@link MessageCursor}) and decides them in order:
 * <ol>
 * <li>approval replies go to {@link HostChangeApprovalService}</li>
 * <li>ineligible messages (unregistered chat, trigger mismatch) are
 * skipped</li>
 * <li>eligible messages invoke the agent with every message received since the
 * chat's last agent turn, and the result is sent back to the chat</li>
 * </ol>
 * The global watermark advances past a message once it is decided. An agent
 * failure stops the batch without advancing either watermark, so the message
 * and its missed context are fetched again next cycle.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class MessageRouter {

    private final RouterState routerState;
    private final ChatHistoryService chatHistoryService;
    private final AuthorizationService authorizationService;
    private final HostChangeApprovalService hostChangeApprovalService;
    private final AgentInvoker agentInvoker;
    private final OutboundDispatcher dispatcher;
    private final TypingIndicatorService typingIndicatorService;
    private final RelayProperties properties;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;

    public MessageRouter(RouterState routerState, ChatHistoryService chatHistoryService,
            AuthorizationService authorizationService, HostChangeApprovalService hostChangeApprovalService,
            AgentInvoker agentInvoker, OutboundDispatcher dispatcher, TypingIndicatorService typingIndicatorService,
            RelayProperties properties) {
        this.routerState = routerState;
        this.chatHistoryService = chatHistoryService;
        this.authorizationService = authorizationService;
        this.hostChangeApprovalService = hostChangeApprovalService;
        this.agentInvoker = agentInvoker;
        this.dispatcher = dispatcher;
        this.typingIndicatorService = typingIndicatorService;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        long interval = properties.getRouter().getPollIntervalMs();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "message-router");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::tick, interval, interval, TimeUnit.MILLISECONDS);
        log.info("[Router] Started, polling every {}ms (batch size {})", interval,
                properties.getRouter().getBatchSize());
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
        log.info("[Router] Shut down");
    }

    private void tick() {
        if (!executing.compareAndSet(false, true)) {
            return;
        }
        try {
            runCycle();
        } catch (RuntimeException e) {
            log.error("[Router] Delivery cycle failed", e);
        } finally {
            executing.set(false);
        }
    }

    /**
     * Run one delivery cycle.
     *
     * @return number of messages decided
     */
    public int runCycle() {
        Map<String, RegisteredGroup> groups = routerState.getRegisteredGroups();
        if (groups.isEmpty()) {
            return 0;
        }
        List<InboundMessage> batch = chatHistoryService.getNewMessages(groups.keySet(),
                routerState.getLastDelivered(), properties.getRouter().getBatchSize());
        if (batch.isEmpty()) {
            return 0;
        }
        log.debug("[Router] {} new message(s)", batch.size());

        int decided = 0;
        for (InboundMessage message : batch) {
            if (!decide(message)) {
                log.warn("[Router] Stopping batch at message {} in {}, will retry next cycle",
                        message.getId(), message.getChatIdentity());
                break;
            }
            routerState.advanceLastDelivered(MessageCursor.of(message));
            decided++;
        }
        return decided;
    }

    /**
     * @return false if the message must be retried
     */
    private boolean decide(InboundMessage message) {
        if (hostChangeApprovalService.tryHandleApprovalMessage(message)) {
            return true;
        }
        Optional<RegisteredGroup> group = authorizationService.eligibleGroup(message);
        if (group.isEmpty()) {
            return true;
        }
        return invokeAgent(group.get(), message);
    }

    private boolean invokeAgent(RegisteredGroup group, InboundMessage trigger) {
        String chatIdentity = trigger.getChatIdentity();
        MessageCursor triggerPosition = MessageCursor.of(trigger);
        MessageCursor since = routerState.getLastAgentRun(chatIdentity).orElse(null);
        List<InboundMessage> missed = chatHistoryService.getMessagesSince(chatIdentity, since).stream()
                .filter(message -> !triggerPosition.precedes(message))
                .toList();
        if (missed.isEmpty()) {
            missed = List.of(trigger);
        }
        String prompt = PromptFormatter.formatMessages(missed);

        log.info("[Router] Processing {} message(s) for group {} ({})", missed.size(), group.getFolder(),
                chatIdentity);
        String result;
        typingIndicatorService.start(chatIdentity);
        try {
            result = agentInvoker.invoke(group, chatIdentity, prompt, false, true);
        } catch (RuntimeException e) {
            log.error("[Router] Agent invocation failed for {}: {}", chatIdentity, e.getMessage());
            return false;
        } finally {
            typingIndicatorService.stop(chatIdentity);
        }

        routerState.advanceLastAgentRun(chatIdentity, triggerPosition);
        if (result != null && !result.isBlank()) {
            dispatcher.sendText(chatIdentity, result);
        }
        return true;
    }
}
