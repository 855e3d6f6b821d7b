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

import me.golemcore.relay.domain.model.HostChangeCallbackEvent;
import me.golemcore.relay.domain.model.HostModificationRequest;
import me.golemcore.relay.domain.model.InboundMessage;
import me.golemcore.relay.domain.state.RouterState;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.GroupWorkspacePort;
import me.golemcore.relay.port.outbound.HostChangeApplierPort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Human approval of agent requests to modify the host.
 *
 * <p>
 * An agent asks for host changes by writing {@value #PENDING_FILE} into its
 * group workspace. The scanner announces the plan in the group's chat and
 * renames the file to {@value #NOTIFIED_FILE}. Transitions are one-way:
 *
 * <pre>
 * pending → approved → applied
 * pending → approved → failed
 * pending → denied
 * </pre>
 *
 * Requests live in memory only and are lost on restart.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class HostChangeApprovalService {

    static final String PENDING_FILE = "PENDING_HOST_CHANGES.md";
    static final String NOTIFIED_FILE = "PENDING_HOST_CHANGES.notified.md";
    private static final String DENIED_PREFIX = "HOST_CHANGES_DENIED_";
    private static final String APPLIED_PREFIX = "HOST_CHANGES_APPLIED_";
    private static final Pattern APPROVAL_PATTERN = Pattern.compile("^(approve|deny)(?:\\s+(hc-\\d+))?\\s*$",
            Pattern.CASE_INSENSITIVE);
    private static final String SUMMARY_HEADING = "## summary";
    private static final int MAX_SUMMARY_LENGTH = 200;
    private static final int MAX_OUTPUT_LENGTH = 500;
    private static final int MAX_ERROR_LENGTH = 300;
    private static final String NO_SUMMARY = "No summary provided";

    private final GroupWorkspacePort groupWorkspace;
    private final RouterState routerState;
    private final OutboundDispatcher dispatcher;
    private final HostChangeApplierPort applier;
    private final RelayProperties properties;
    private final Clock clock;
    private final Map<String, HostModificationRequest> requests = new LinkedHashMap<>();
    private final AtomicBoolean scanning = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;

    public HostChangeApprovalService(GroupWorkspacePort groupWorkspace, RouterState routerState,
            OutboundDispatcher dispatcher, HostChangeApplierPort applier, RelayProperties properties, Clock clock) {
        this.groupWorkspace = groupWorkspace;
        this.routerState = routerState;
        this.dispatcher = dispatcher;
        this.applier = applier;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (!properties.getHostChanges().isEnabled()) {
            log.info("[HostChanges] Disabled");
            return;
        }
        long interval = properties.getHostChanges().getScanIntervalMs();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "host-change-scanner");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::tick, interval, interval, TimeUnit.MILLISECONDS);
        log.info("[HostChanges] Scanning group workspaces every {}ms", interval);
    }

    @PreDestroy
    public void shutdown() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    private void tick() {
        if (!scanning.compareAndSet(false, true)) {
            return;
        }
        try {
            scan();
        } catch (RuntimeException e) {
            log.error("[HostChanges] Scan failed", e);
        } finally {
            scanning.set(false);
        }
    }

    /**
     * Announce every new plan file. A folder with an open request is skipped
     * until that request is resolved.
     *
     * @return number of requests announced
     */
    public int scan() {
        int announced = 0;
        for (String folder : groupWorkspace.listGroupFolders()) {
            if (hasOpenRequest(folder) || !groupWorkspace.exists(folder, PENDING_FILE)) {
                continue;
            }
            try {
                if (announce(folder)) {
                    announced++;
                }
            } catch (RuntimeException e) {
                log.error("[HostChanges] Failed to announce plan for {}", folder, e);
            }
        }
        return announced;
    }

    private boolean announce(String folder) {
        Optional<String> chatIdentity = routerState.findIdentityByFolder(folder);
        if (chatIdentity.isEmpty()) {
            log.warn("[HostChanges] Plan in {} has no registered chat, ignoring", folder);
            return false;
        }
        String content = groupWorkspace.readFile(folder, PENDING_FILE).orElse("");
        if (!groupWorkspace.renameFile(folder, PENDING_FILE, NOTIFIED_FILE)) {
            return false;
        }

        HostModificationRequest request;
        synchronized (this) {
            request = HostModificationRequest.builder()
                    .id(nextId())
                    .groupFolder(folder)
                    .chatIdentity(chatIdentity.get())
                    .summary(extractSummary(content))
                    .filePath(groupWorkspace.describePath(folder, NOTIFIED_FILE))
                    .timestamp(clock.instant())
                    .status(HostModificationRequest.Status.PENDING)
                    .build();
            requests.put(request.getId(), request);
        }

        log.info("[HostChanges] Request {} created for group {}", request.getId(), folder);
        dispatcher.sendApprovalPrompt(request.getChatIdentity(), request, formatPrompt(request));
        return true;
    }

    /**
     * Resolve a plain-text {@code approve}/{@code deny} reply.
     *
     * @return true if the message was consumed as an approval reply, false if
     *         it should be routed normally
     */
    public boolean tryHandleApprovalMessage(InboundMessage message) {
        if (message.getBody() == null) {
            return false;
        }
        Matcher matcher = APPROVAL_PATTERN.matcher(message.getBody().trim());
        if (!matcher.matches()) {
            return false;
        }
        boolean approve = "approve".equalsIgnoreCase(matcher.group(1));
        String explicitId = matcher.group(2);
        String chatIdentity = message.getChatIdentity();

        if (explicitId == null) {
            Optional<HostModificationRequest> latest = latestPending(chatIdentity);
            if (latest.isEmpty()) {
                return false;
            }
            resolve(latest.get(), approve, message.getSenderName());
            return true;
        }

        HostModificationRequest request = find(explicitId.toLowerCase(Locale.ROOT));
        if (request == null || !chatIdentity.equals(request.getChatIdentity())) {
            log.warn("[HostChanges] {} for {} from chat {} rejected: unknown or foreign request",
                    matcher.group(1), explicitId, chatIdentity);
            dispatcher.sendText(chatIdentity, "Unknown or expired request.");
            return true;
        }
        resolve(request, approve, message.getSenderName());
        return true;
    }

    @EventListener
    public void onCallback(HostChangeCallbackEvent event) {
        HostModificationRequest request = find(event.requestId());
        if (request == null || !request.getChatIdentity().equals(event.chatIdentity())) {
            log.warn("[HostChanges] Callback for unknown request {} from {}", event.requestId(),
                    event.chatIdentity());
            dispatcher.sendText(event.chatIdentity(), "Unknown or expired request.");
            return;
        }
        resolve(request, "approve".equalsIgnoreCase(event.action()), event.userName());
    }

    /**
     * Apply a decision. Only pending requests change state.
     */
    void resolve(HostModificationRequest request, boolean approve, String decidedBy) {
        synchronized (this) {
            if (request.getStatus() != HostModificationRequest.Status.PENDING) {
                dispatcher.sendText(request.getChatIdentity(),
                        "Request already " + request.getStatus().name().toLowerCase(Locale.ROOT));
                return;
            }
            request.setStatus(approve ? HostModificationRequest.Status.APPROVED
                    : HostModificationRequest.Status.DENIED);
            request.setApprovedBy(decidedBy);
        }

        if (!approve) {
            groupWorkspace.renameFile(request.getGroupFolder(), NOTIFIED_FILE, deniedFileName());
            log.info("[HostChanges] Request {} denied by {}", request.getId(), decidedBy);
            dispatcher.sendText(request.getChatIdentity(), "Host changes request `" + request.getId() + "` denied.");
            return;
        }

        log.info("[HostChanges] Request {} approved by {}, applying", request.getId(), decidedBy);
        dispatcher.sendText(request.getChatIdentity(),
                "Host changes request `" + request.getId() + "` approved. Applying...");
        apply(request);
    }

    private void apply(HostModificationRequest request) {
        String folder = request.getGroupFolder();
        try {
            String plan = groupWorkspace.readFile(folder, NOTIFIED_FILE)
                    .orElseThrow(() -> new IllegalStateException("Plan file is missing: " + request.getFilePath()));
            String output = applier.apply(folder, plan);
            groupWorkspace.renameFile(folder, NOTIFIED_FILE, appliedFileName());
            synchronized (this) {
                request.setStatus(HostModificationRequest.Status.APPLIED);
            }
            log.info("[HostChanges] Request {} applied", request.getId());
            dispatcher.sendText(request.getChatIdentity(), "Host changes `" + request.getId()
                    + "` applied successfully.\n\n" + truncate(output != null ? output : "", MAX_OUTPUT_LENGTH));
        } catch (RuntimeException e) {
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            synchronized (this) {
                request.setStatus(HostModificationRequest.Status.FAILED);
                request.setError(error);
            }
            log.error("[HostChanges] Request {} failed: {}", request.getId(), error);
            dispatcher.sendText(request.getChatIdentity(), "Host changes `" + request.getId()
                    + "` failed to apply: " + truncate(error, MAX_ERROR_LENGTH));
        }
    }

    public synchronized List<HostModificationRequest> getRequests() {
        return List.copyOf(requests.values());
    }

    public synchronized HostModificationRequest find(String requestId) {
        return requests.get(requestId);
    }

    private synchronized Optional<HostModificationRequest> latestPending(String chatIdentity) {
        return requests.values().stream()
                .filter(r -> r.getStatus() == HostModificationRequest.Status.PENDING)
                .filter(r -> chatIdentity.equals(r.getChatIdentity()))
                .max(Comparator.comparing(HostModificationRequest::getTimestamp));
    }

    private synchronized boolean hasOpenRequest(String folder) {
        return requests.values().stream()
                .filter(r -> folder.equals(r.getGroupFolder()))
                .anyMatch(r -> r.getStatus() == HostModificationRequest.Status.PENDING
                        || r.getStatus() == HostModificationRequest.Status.APPROVED);
    }

    private String nextId() {
        long millis = clock.millis();
        while (requests.containsKey("hc-" + millis)) {
            millis++;
        }
        return "hc-" + millis;
    }

    private String deniedFileName() {
        return DENIED_PREFIX + clock.millis() + ".md";
    }

    private String appliedFileName() {
        return APPLIED_PREFIX + clock.millis() + ".md";
    }

    static String formatPrompt(HostModificationRequest request) {
        return "Host Changes Request (`" + request.getId() + "`)\n"
                + "Group: " + request.getGroupFolder() + "\n"
                + "Summary: " + request.getSummary() + "\n\n"
                + "Reply \"approve\" or \"deny\"";
    }

    /**
     * Text under a {@code ## Summary} heading up to the next section, else the
     * first non-heading line.
     */
    static String extractSummary(String content) {
        if (content == null || content.isBlank()) {
            return NO_SUMMARY;
        }
        String[] lines = content.split("\\r?\\n");
        StringBuilder section = new StringBuilder();
        boolean inSummary = false;
        for (String line : lines) {
            String trimmed = line.trim();
            if (inSummary) {
                if (trimmed.startsWith("## ") || trimmed.startsWith("---")) {
                    break;
                }
                if (!trimmed.isEmpty()) {
                    if (section.length() > 0) {
                        section.append(' ');
                    }
                    section.append(trimmed);
                }
            } else if (trimmed.toLowerCase(Locale.ROOT).equals(SUMMARY_HEADING)) {
                inSummary = true;
            }
        }
        if (section.length() > 0) {
            return truncate(section.toString(), MAX_SUMMARY_LENGTH);
        }
        for (String line : lines) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                return truncate(trimmed, MAX_SUMMARY_LENGTH);
            }
        }
        return NO_SUMMARY;
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }
}
