package me.golemcore.relay.domain.service;

import me.golemcore.relay.adapter.outbound.storage.LocalGroupWorkspaceAdapter;
import me.golemcore.relay.domain.model.HostChangeCallbackEvent;
import me.golemcore.relay.domain.model.HostModificationRequest;
import me.golemcore.relay.domain.model.InboundMessage;
import me.golemcore.relay.domain.model.RegisteredGroup;
import me.golemcore.relay.domain.state.RouterState;
import me.golemcore.relay.infrastructure.config.AutoConfiguration;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.HostChangeApplierPort;
import me.golemcore.relay.port.outbound.HostChangeApplyException;
import me.golemcore.relay.testsupport.InMemoryStoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HostChangeApprovalServiceTest {

    private static final String CHAT = "family@g.us";
    private static final String OTHER_CHAT = "work@g.us";
    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final String PLAN = "# Plan\n\n## Summary\nInstall ffmpeg\nfor voice notes\n\n## Steps\n1. apt install\n";

    @TempDir
    Path tempDir;

    private Clock clock;
    private OutboundDispatcher dispatcher;
    private HostChangeApplierPort applier;
    private HostChangeApprovalService service;
    private Path groupsRoot;

    @BeforeEach
    void setUp() {
        RelayProperties properties = new RelayProperties();
        groupsRoot = tempDir.resolve("groups");
        properties.getGroups().setDirectory(groupsRoot.toString());
        LocalGroupWorkspaceAdapter workspace = new LocalGroupWorkspaceAdapter(properties);
        workspace.init();

        RouterState routerState = new RouterState(new InMemoryStoragePort(), AutoConfiguration.objectMapper());
        routerState.load();
        routerState.registerGroup(CHAT, RegisteredGroup.builder().name("Family").folder("family").build());
        routerState.registerGroup(OTHER_CHAT, RegisteredGroup.builder().name("Work").folder("work").build());

        clock = mock(Clock.class);
        setTime(T0);
        dispatcher = mock(OutboundDispatcher.class);
        applier = mock(HostChangeApplierPort.class);
        service = new HostChangeApprovalService(workspace, routerState, dispatcher, applier, properties, clock);
    }

    @Test
    void shouldAnnounceNewPlanOnceAndRenameIt() throws IOException {
        writePlan("family", PLAN);

        assertEquals(1, service.scan());
        assertEquals(0, service.scan());

        HostModificationRequest request = service.getRequests().get(0);
        assertEquals("hc-" + T0.toEpochMilli(), request.getId());
        assertEquals(HostModificationRequest.Status.PENDING, request.getStatus());
        assertEquals("Install ffmpeg for voice notes", request.getSummary());
        assertFalse(Files.exists(groupsRoot.resolve("family/" + HostChangeApprovalService.PENDING_FILE)));
        assertTrue(Files.exists(groupsRoot.resolve("family/" + HostChangeApprovalService.NOTIFIED_FILE)));
        verify(dispatcher).sendApprovalPrompt(eq(CHAT), eq(request), contains("Install ffmpeg"));
    }

    @Test
    void shouldIgnorePlanFromUnregisteredFolder() throws IOException {
        writePlan("stranger", PLAN);

        assertEquals(0, service.scan());
        assertTrue(Files.exists(groupsRoot.resolve("stranger/" + HostChangeApprovalService.PENDING_FILE)));
    }

    @Test
    void shouldApplyOnUnqualifiedApproval() throws IOException {
        writePlan("family", PLAN);
        service.scan();
        when(applier.apply("family", PLAN)).thenReturn("Installed ffmpeg 6.1");

        assertTrue(service.tryHandleApprovalMessage(reply(CHAT, "Approve")));

        HostModificationRequest request = service.getRequests().get(0);
        assertEquals(HostModificationRequest.Status.APPLIED, request.getStatus());
        assertEquals("Alice", request.getApprovedBy());
        verify(dispatcher).sendText(eq(CHAT), contains("applied successfully.\n\nInstalled ffmpeg 6.1"));
        assertEquals(List.of("HOST_CHANGES_APPLIED_" + T0.toEpochMilli() + ".md"), listFiles("family"));
    }

    @Test
    void shouldRecordFailureWhenApplyFails() throws IOException {
        writePlan("family", PLAN);
        service.scan();
        when(applier.apply(anyString(), anyString())).thenThrow(new HostChangeApplyException("timed out"));

        service.tryHandleApprovalMessage(reply(CHAT, "approve"));

        HostModificationRequest request = service.getRequests().get(0);
        assertEquals(HostModificationRequest.Status.FAILED, request.getStatus());
        assertEquals("timed out", request.getError());
        verify(dispatcher).sendText(eq(CHAT), contains("failed to apply: timed out"));
        assertEquals(List.of(HostChangeApprovalService.NOTIFIED_FILE), listFiles("family"));
    }

    @Test
    void shouldDenyAndArchivePlan() throws IOException {
        writePlan("family", PLAN);
        service.scan();
        String id = service.getRequests().get(0).getId();

        assertTrue(service.tryHandleApprovalMessage(reply(CHAT, "deny " + id)));

        assertEquals(HostModificationRequest.Status.DENIED, service.find(id).getStatus());
        verify(applier, never()).apply(anyString(), anyString());
        assertEquals(List.of("HOST_CHANGES_DENIED_" + T0.toEpochMilli() + ".md"), listFiles("family"));
    }

    @Test
    void shouldResolveMostRecentPendingRequestOfTheChat() throws IOException {
        writePlan("family", PLAN);
        service.scan();
        String first = service.getRequests().get(0).getId();
        service.tryHandleApprovalMessage(reply(CHAT, "deny"));

        setTime(T0.plusSeconds(60));
        writePlan("family", "Add a cron job");
        service.scan();
        String second = service.getRequests().get(1).getId();
        when(applier.apply(anyString(), anyString())).thenReturn("ok");

        service.tryHandleApprovalMessage(reply(CHAT, "approve"));

        assertEquals(HostModificationRequest.Status.DENIED, service.find(first).getStatus());
        assertEquals(HostModificationRequest.Status.APPLIED, service.find(second).getStatus());
        assertEquals("Add a cron job", service.find(second).getSummary());
    }

    @Test
    void shouldLetUnqualifiedReplyThroughWhenNothingIsPending() {
        assertFalse(service.tryHandleApprovalMessage(reply(CHAT, "approve")));
        assertFalse(service.tryHandleApprovalMessage(reply(CHAT, "approve the budget please")));
    }

    @Test
    void shouldRejectExplicitIdFromAnotherChat() throws IOException {
        writePlan("family", PLAN);
        service.scan();
        String id = service.getRequests().get(0).getId();

        assertTrue(service.tryHandleApprovalMessage(reply(OTHER_CHAT, "approve " + id)));

        assertEquals(HostModificationRequest.Status.PENDING, service.find(id).getStatus());
        verify(dispatcher).sendText(OTHER_CHAT, "Unknown or expired request.");
    }

    @Test
    void shouldResolveButtonCallbackOnlyOnce() throws IOException {
        writePlan("family", PLAN);
        service.scan();
        String id = service.getRequests().get(0).getId();

        service.onCallback(new HostChangeCallbackEvent(id, "deny", CHAT, "10", "Bob"));
        service.onCallback(new HostChangeCallbackEvent(id, "approve", CHAT, "10", "Bob"));

        assertEquals(HostModificationRequest.Status.DENIED, service.find(id).getStatus());
        verify(dispatcher).sendText(CHAT, "Request already denied");
        verify(applier, never()).apply(anyString(), anyString());
    }

    @Test
    void shouldExtractSummaryVariants() {
        assertEquals("Do the thing", HostChangeApprovalService.extractSummary("## Summary\nDo the thing\n---\nrest"));
        assertEquals("First line", HostChangeApprovalService.extractSummary("# Title\n\nFirst line\nSecond"));
        assertEquals("No summary provided", HostChangeApprovalService.extractSummary("# Only heading\n"));
        assertEquals("No summary provided", HostChangeApprovalService.extractSummary(""));
        assertEquals(200, HostChangeApprovalService.extractSummary("x".repeat(500)).length());
    }

    @Test
    void shouldFormatPlainTextPrompt() {
        HostModificationRequest request = HostModificationRequest.builder()
                .id("hc-1").groupFolder("family").summary("Install ffmpeg").build();

        String prompt = HostChangeApprovalService.formatPrompt(request);

        assertTrue(prompt.startsWith("Host Changes Request (`hc-1`)"));
        assertTrue(prompt.contains("Reply \"approve\" or \"deny\""));
    }

    private void setTime(Instant instant) {
        when(clock.instant()).thenReturn(instant);
        when(clock.millis()).thenReturn(instant.toEpochMilli());
    }

    private void writePlan(String folder, String content) throws IOException {
        Path dir = Files.createDirectories(groupsRoot.resolve(folder));
        Files.writeString(dir.resolve(HostChangeApprovalService.PENDING_FILE), content);
    }

    private List<String> listFiles(String folder) throws IOException {
        try (Stream<Path> files = Files.list(groupsRoot.resolve(folder))) {
            return files.map(path -> path.getFileName().toString()).sorted().toList();
        }
    }

    private static InboundMessage reply(String chat, String body) {
        return InboundMessage.builder()
                .id("r-" + body.hashCode())
                .chatIdentity(chat)
                .senderName("Alice")
                .body(body)
                .timestamp(T0)
                .build();
    }
}
