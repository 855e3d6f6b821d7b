package me.golemcore.relay.domain.service;

import me.golemcore.relay.domain.model.IncomingEmail;
import me.golemcore.relay.domain.model.RegisteredGroup;
import me.golemcore.relay.infrastructure.config.AutoConfiguration;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.MailboxException;
import me.golemcore.relay.port.outbound.MailboxPort;
import me.golemcore.relay.testsupport.InMemoryStoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EmailChannelServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private MailboxPort mailbox;
    private ProcessedEmailService processedEmailService;
    private GroupRegistrationService groupRegistrationService;
    private AgentInvoker agentInvoker;
    private RelayProperties properties;
    private EmailChannelService service;

    @BeforeEach
    void setUp() {
        mailbox = mock(MailboxPort.class);
        processedEmailService = new ProcessedEmailService(new InMemoryStoragePort(), AutoConfiguration.objectMapper());
        groupRegistrationService = mock(GroupRegistrationService.class);
        agentInvoker = mock(AgentInvoker.class);
        properties = new RelayProperties();
        service = new EmailChannelService(mailbox, processedEmailService, groupRegistrationService, agentInvoker,
                properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldAnswerEmailAndMarkItHandled() {
        IncomingEmail email = email("m1", "t1");
        when(mailbox.fetchUnread(10)).thenReturn(List.of(email));
        when(agentInvoker.invoke(any(), anyString(), anyString(), anyBoolean(), anyBoolean()))
                .thenReturn("Happy to help");

        assertEquals(1, service.pollOnce());

        ArgumentCaptor<RegisteredGroup> group = ArgumentCaptor.forClass(RegisteredGroup.class);
        verify(agentInvoker).invoke(group.capture(), eq("email:alice@example.com"), contains("<email>"),
                eq(false), eq(true));
        assertEquals("email-thread-t1", group.getValue().getFolder());
        assertTrue(group.getValue().isAutoRespond());
        verify(groupRegistrationService).prepareEphemeralWorkspace(eq("email-thread-t1"), anyString());
        verify(mailbox).sendReply(email, "Happy to help");
        verify(mailbox).markHandled("m1");
        assertTrue(processedEmailService.find("m1").orElseThrow().isResponded());
    }

    @Test
    void shouldResendStoredReplyWithoutRunningAgentAgain() {
        IncomingEmail email = email("m1", "t1");
        when(mailbox.fetchUnread(anyInt())).thenReturn(List.of(email));
        when(agentInvoker.invoke(any(), anyString(), anyString(), anyBoolean(), anyBoolean())).thenReturn("Reply");
        doThrow(new MailboxException("SMTP down", null)).doNothing().when(mailbox).sendReply(email, "Reply");

        assertEquals(0, service.pollOnce());
        assertFalse(processedEmailService.find("m1").orElseThrow().isResponded());
        assertEquals("Reply", processedEmailService.find("m1").orElseThrow().getReplyBody());
        verify(mailbox, never()).markHandled("m1");

        assertEquals(1, service.pollOnce());

        verify(agentInvoker, times(1)).invoke(any(), anyString(), anyString(), anyBoolean(), anyBoolean());
        verify(mailbox, times(2)).sendReply(email, "Reply");
        verify(mailbox).markHandled("m1");
        assertTrue(processedEmailService.find("m1").orElseThrow().isResponded());
    }

    @Test
    void shouldSkipAlreadyRespondedEmail() {
        IncomingEmail email = email("m1", "t1");
        when(mailbox.fetchUnread(anyInt())).thenReturn(List.of(email));
        when(agentInvoker.invoke(any(), anyString(), anyString(), anyBoolean(), anyBoolean())).thenReturn("Reply");
        service.pollOnce();

        assertEquals(0, service.pollOnce());

        verify(agentInvoker, times(1)).invoke(any(), anyString(), anyString(), anyBoolean(), anyBoolean());
        verify(mailbox, times(2)).markHandled("m1");
    }

    @Test
    void shouldRetryAgentWhenItFailedBeforeReplying() {
        IncomingEmail email = email("m1", "t1");
        when(mailbox.fetchUnread(anyInt())).thenReturn(List.of(email));
        when(agentInvoker.invoke(any(), anyString(), anyString(), anyBoolean(), anyBoolean()))
                .thenThrow(new AgentInvocationException("sandbox down"))
                .thenReturn("Second try");

        assertEquals(0, service.pollOnce());
        assertEquals(1, service.pollOnce());

        verify(mailbox).sendReply(email, "Second try");
    }

    @Test
    void shouldKeepPollingAfterOneEmailFails() {
        IncomingEmail broken = email("m1", "t1");
        IncomingEmail fine = email("m2", "t2");
        when(mailbox.fetchUnread(anyInt())).thenReturn(List.of(broken, fine));
        when(agentInvoker.invoke(any(), anyString(), anyString(), anyBoolean(), anyBoolean()))
                .thenThrow(new AgentInvocationException("boom"))
                .thenReturn("ok");

        assertEquals(1, service.pollOnce());
        verify(mailbox).sendReply(fine, "ok");
    }

    @Test
    void shouldPrefixReply() {
        properties.getChannels().getEmail().setReplyPrefix("[Golem] ");
        IncomingEmail email = email("m1", "t1");
        when(mailbox.fetchUnread(anyInt())).thenReturn(List.of(email));
        when(agentInvoker.invoke(any(), anyString(), anyString(), anyBoolean(), anyBoolean())).thenReturn("Hi");

        service.pollOnce();

        verify(mailbox).sendReply(email, "[Golem] Hi");
    }

    @Test
    void shouldDeriveContextKeyPerMode() {
        IncomingEmail email = email("<abc@mail>", "<root.id@mail.example>");

        assertEquals("email-thread-_root_id_mail_example_", service.contextKey(email));

        properties.getChannels().getEmail().setContextMode("sender");
        assertEquals("email-sender-alice@example.com", service.contextKey(email));

        properties.getChannels().getEmail().setContextMode("single");
        assertEquals("email-main", service.contextKey(email));
    }

    @Test
    void shouldExtractBareAddress() {
        assertEquals("alice@example.com", EmailChannelService.bareAddress("Alice Doe <alice@example.com>"));
        assertEquals("bob@example.com", EmailChannelService.bareAddress(" bob@example.com "));
        assertEquals("", EmailChannelService.bareAddress(null));
    }

    private static IncomingEmail email(String id, String threadId) {
        return IncomingEmail.builder()
                .id(id)
                .threadId(threadId)
                .messageId(id)
                .from("Alice <Alice@Example.com>")
                .subject("Question")
                .body("Can you help?")
                .receivedAt(NOW)
                .build();
    }
}
