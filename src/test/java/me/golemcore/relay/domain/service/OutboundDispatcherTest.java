package me.golemcore.relay.domain.service;

import me.golemcore.relay.domain.model.HostModificationRequest;
import me.golemcore.relay.port.inbound.ChannelPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OutboundDispatcherTest {

    private ChannelPort socket;
    private ChannelPort telegram;
    private OutboundDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        socket = mock(ChannelPort.class);
        when(socket.getChannelType()).thenReturn(ChatIdentities.SOCKET);
        when(socket.getMaxMessageLength()).thenReturn(10);
        when(socket.sendMessage(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));

        telegram = mock(ChannelPort.class);
        when(telegram.getChannelType()).thenReturn(ChatIdentities.TELEGRAM);
        when(telegram.getMaxMessageLength()).thenReturn(4096);
        when(telegram.sendMessage(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));

        dispatcher = new OutboundDispatcher(List.of(socket, telegram));
    }

    @Test
    void shouldRouteByIdentityPrefix() {
        assertTrue(dispatcher.sendText("telegram:42", "hi"));
        assertTrue(dispatcher.sendText("111@g.us", "hi"));

        verify(telegram).sendMessage("telegram:42", "hi");
        verify(socket).sendMessage("111@g.us", "hi");
    }

    @Test
    void shouldSplitToChannelLimit() {
        assertTrue(dispatcher.sendText("111@g.us", "one two three four"));

        verify(socket, times(3)).sendMessage(eq("111@g.us"), anyString());
    }

    @Test
    void shouldReportFailureWithoutThrowing() {
        when(socket.sendMessage(anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("not connected")));

        assertFalse(dispatcher.sendText("111@g.us", "hi"));
    }

    @Test
    void shouldReportMissingChannel() {
        OutboundDispatcher socketOnly = new OutboundDispatcher(List.of(socket));

        assertFalse(socketOnly.sendText("email:alice@example.com", "hi"));
    }

    @Test
    void shouldSwallowTypingFailures() {
        doThrow(new IllegalStateException("gone")).when(socket).setTyping("111@g.us", true);

        dispatcher.setTyping("111@g.us", true);

        verify(socket).setTyping("111@g.us", true);
    }

    @Test
    void shouldFallBackToPlainTextWhenPromptFails() {
        HostModificationRequest request = HostModificationRequest.builder().id("hc-1").build();
        when(telegram.sendApprovalPrompt(anyString(), any(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("markup rejected")));

        assertTrue(dispatcher.sendApprovalPrompt("telegram:42", request, "approve hc-1?"));

        verify(telegram).sendMessage("telegram:42", "approve hc-1?");
    }

    @Test
    void shouldRequestGroupSyncOnlyFromRunningChannels() {
        when(socket.isRunning()).thenReturn(true);
        when(telegram.isRunning()).thenReturn(false);

        dispatcher.requestGroupSync();

        verify(socket).requestGroupSync();
        verify(telegram, never()).requestGroupSync();
    }
}
