package me.golemcore.relay.domain.service;

import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

class TypingIndicatorServiceTest {

    private static final String CHAT = "111@g.us";

    private OutboundDispatcher dispatcher;
    private TypingIndicatorService service;

    @BeforeEach
    void setUp() {
        dispatcher = mock(OutboundDispatcher.class);
        RelayProperties properties = new RelayProperties();
        properties.getRouter().setTypingRefreshIntervalMs(20);
        service = new TypingIndicatorService(dispatcher, properties);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @Test
    void shouldRefreshUntilStopped() {
        service.start(CHAT);

        verify(dispatcher, timeout(1000).atLeast(2)).setTyping(CHAT, true);
        assertTrue(service.isActive(CHAT));

        service.stop(CHAT);

        assertFalse(service.isActive(CHAT));
        verify(dispatcher).setTyping(CHAT, false);
    }

    @Test
    void shouldClearAfterDuration() {
        service.startFor(CHAT, 50);

        verify(dispatcher, timeout(1000)).setTyping(CHAT, false);
        assertFalse(service.isActive(CHAT));
    }

    @Test
    void shouldSupersedePreviousIndicatorForSameChat() {
        service.startFor(CHAT, 50);
        service.start(CHAT);

        verify(dispatcher, timeout(1000).atLeast(3)).setTyping(CHAT, true);
        assertTrue(service.isActive(CHAT));
    }
}
