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

package me.golemcore.relay.domain.service;

import me.golemcore.relay.domain.model.AgentRequest;
import me.golemcore.relay.domain.model.AgentResponse;
import me.golemcore.relay.domain.model.ChatMetadata;
import me.golemcore.relay.domain.model.RegisteredGroup;
import me.golemcore.relay.domain.model.ScheduledTask;
import me.golemcore.relay.domain.state.RouterState;
import me.golemcore.relay.port.outbound.AgentRunnerPort;
import me.golemcore.relay.port.outbound.SandboxSnapshotPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one agent turn for a group.
 *
 * <p>
 * Before the call the sandbox receives read-only snapshots of the tasks and
 * groups the invoking group may see: the privileged group sees everything,
 * other groups see their own tasks and no groups. Session tokens returned by
 * the sandbox replace the group's stored token.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentInvoker {

    private final AgentRunnerPort agentRunner;
    private final SandboxSnapshotPort snapshotPort;
    private final RouterState routerState;
    private final TaskService taskService;
    private final ChatHistoryService chatHistoryService;
    private final AuthorizationService authorizationService;

    /**
     * Invoke the agent.
     *
     * @param group
     *            group on whose behalf the agent runs
     * @param chatIdentity
     *            chat the result belongs to
     * @param prompt
     *            prompt text
     * @param scheduled
     *            true when triggered by the task scheduler
     * @param withSession
     *            continue the group's session and store the returned token
     * @return the agent's textual result, possibly null
     * @throws AgentInvocationException
     *             if the sandbox reports an error
     */
    public String invoke(RegisteredGroup group, String chatIdentity, String prompt, boolean scheduled,
            boolean withSession) {
        String folder = group.getFolder();
        boolean privileged = authorizationService.isPrivileged(folder);

        writeTasksSnapshot(folder);
        writeGroupsSnapshot(folder);

        AgentRequest request = AgentRequest.builder()
                .prompt(prompt)
                .sessionToken(withSession ? routerState.getSession(folder).orElse(null) : null)
                .groupFolder(folder)
                .chatIdentity(chatIdentity)
                .privilegedGroup(privileged)
                .scheduledInvocation(scheduled)
                .containerConfig(group.getContainerConfig())
                .build();

        log.info("[Agent] Invoking for group {} (chat={}, scheduled={})", folder, chatIdentity, scheduled);
        AgentResponse response = agentRunner.run(request);

        if (response == null || !response.isSuccess()) {
            String error = response != null ? response.getError() : "no response";
            throw new AgentInvocationException("Agent failed for group " + folder + ": " + error);
        }
        if (withSession && response.getNewSessionToken() != null) {
            routerState.setSession(folder, response.getNewSessionToken());
        }
        return response.getResult();
    }

    public void writeTasksSnapshot(String folder) {
        List<ScheduledTask> visible = authorizationService.isPrivileged(folder)
                ? taskService.getTasks()
                : taskService.getTasksForGroup(folder);
        List<Map<String, Object>> tasks = visible.stream().map(this::toSnapshot).toList();
        snapshotPort.writeTasksSnapshot(folder, tasks);
    }

    public void writeGroupsSnapshot(String folder) {
        if (!authorizationService.isPrivileged(folder)) {
            snapshotPort.writeGroupsSnapshot(folder, List.of());
            return;
        }
        List<Map<String, Object>> groups = chatHistoryService.getGroupChats().stream()
                .map(this::toSnapshot)
                .toList();
        snapshotPort.writeGroupsSnapshot(folder, groups);
    }

    private Map<String, Object> toSnapshot(ScheduledTask task) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("id", task.getId());
        entry.put("groupFolder", task.getGroupFolder());
        entry.put("prompt", task.getPrompt());
        entry.put("schedule_type", task.getScheduleType().wireName());
        entry.put("schedule_value", task.getScheduleValue());
        entry.put("status", task.getStatus().wireName());
        entry.put("next_run", task.getNextRun() != null ? task.getNextRun().toString() : null);
        return entry;
    }

    private Map<String, Object> toSnapshot(ChatMetadata chat) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("jid", chat.getIdentity());
        entry.put("name", chat.getName());
        entry.put("lastActivity", chat.getLastMessageTime() != null ? chat.getLastMessageTime().toString() : null);
        entry.put("isRegistered", routerState.isRegistered(chat.getIdentity()));
        return entry;
    }
}
