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

import me.golemcore.relay.domain.model.RegisteredGroup;
import me.golemcore.relay.domain.model.ScheduledTask;
import me.golemcore.relay.domain.service.AgentInvoker;
import me.golemcore.relay.domain.service.OutboundDispatcher;
import me.golemcore.relay.domain.service.TaskService;
import me.golemcore.relay.domain.state.RouterState;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs due scheduled tasks.
 *
 * <p>
 * Ticks every {@code relay.scheduler.poll-interval-ms}; a tick that is still
 * running causes the next ones to be skipped. Each due task invokes the agent
 * for its group and the result goes to the task's chat. Tasks in
 * {@code group} context mode continue the group's session, {@code isolated}
 * tasks run without one.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class TaskSchedulerLoop {

    private final TaskService taskService;
    private final RouterState routerState;
    private final AgentInvoker agentInvoker;
    private final OutboundDispatcher dispatcher;
    private final RelayProperties properties;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public TaskSchedulerLoop(TaskService taskService, RouterState routerState, AgentInvoker agentInvoker,
            OutboundDispatcher dispatcher, RelayProperties properties) {
        this.taskService = taskService;
        this.routerState = routerState;
        this.agentInvoker = agentInvoker;
        this.dispatcher = dispatcher;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        if (!properties.getScheduler().isEnabled()) {
            log.info("[Scheduler] Task scheduler disabled");
            return;
        }
        long interval = properties.getScheduler().getPollIntervalMs();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "task-scheduler");
            t.setDaemon(true);
            return t;
        });
        tickTask = scheduler.scheduleAtFixedRate(this::tick, interval, interval, TimeUnit.MILLISECONDS);
        log.info("[Scheduler] Started with tick interval: {}ms", interval);
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
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
        log.info("[Scheduler] Shut down");
    }

    private void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[Scheduler] Previous tick still running, skipping");
            return;
        }
        try {
            runDueTasks();
        } catch (RuntimeException e) {
            log.error("[Scheduler] Tick failed", e);
        } finally {
            executing.set(false);
        }
    }

    /**
     * Run every task that is due now.
     *
     * @return number of tasks run
     */
    public int runDueTasks() {
        List<ScheduledTask> due = taskService.getDueTasks();
        int ran = 0;
        for (ScheduledTask task : due) {
            if (runTask(task)) {
                ran++;
            }
        }
        return ran;
    }

    private boolean runTask(ScheduledTask task) {
        Optional<RegisteredGroup> group = routerState.findGroup(task.getChatIdentity())
                .filter(g -> task.getGroupFolder().equals(g.getFolder()));
        if (group.isEmpty()) {
            log.warn("[Scheduler] Task {} skipped: group {} is no longer registered for {}",
                    task.getId(), task.getGroupFolder(), task.getChatIdentity());
            taskService.recordRun(task.getId(), "Error: group not registered");
            return false;
        }

        log.info("[Scheduler] Running task {} for group {}", task.getId(), task.getGroupFolder());
        boolean withSession = task.getContextMode() == ScheduledTask.ContextMode.GROUP;
        String result;
        try {
            result = agentInvoker.invoke(group.get(), task.getChatIdentity(), task.getPrompt(), true, withSession);
        } catch (RuntimeException e) {
            log.error("[Scheduler] Task {} failed: {}", task.getId(), e.getMessage());
            taskService.recordRun(task.getId(), "Error: " + e.getMessage());
            return false;
        }

        if (result != null && !result.isBlank()) {
            dispatcher.sendText(task.getChatIdentity(), result);
        }
        taskService.recordRun(task.getId(), result != null ? result : "Completed");
        return true;
    }
}
