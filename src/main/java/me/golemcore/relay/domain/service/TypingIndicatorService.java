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

import me.golemcore.relay.infrastructure.config.RelayProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Typing indicators as cancellable repeating tasks, one per chat identity.
 *
 * <p>
 * Starting an indicator for a chat supersedes the one already running for it.
 * The indicator is re-signalled every {@code relay.router.typing-refresh-interval-ms}
 * so platforms whose indicator expires keep showing it.
 */
@Service
@Slf4j
public class TypingIndicatorService {

    private final OutboundDispatcher dispatcher;
    private final long refreshIntervalMs;
    private final ScheduledExecutorService scheduler;
    private final Map<String, ScheduledFuture<?>> active = new ConcurrentHashMap<>();

    public TypingIndicatorService(OutboundDispatcher dispatcher, RelayProperties properties) {
        this.dispatcher = dispatcher;
        this.refreshIntervalMs = properties.getRouter().getTypingRefreshIntervalMs();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "typing-indicator");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Show typing until {@link #stop(String)} is called.
     */
    public void start(String chatIdentity) {
        schedule(chatIdentity);
    }

    /**
     * Show typing for a bounded time, then clear it unless a newer indicator
     * replaced this one.
     */
    public void startFor(String chatIdentity, long durationMs) {
        ScheduledFuture<?> refresh = schedule(chatIdentity);
        scheduler.schedule(() -> {
            if (active.remove(chatIdentity, refresh)) {
                refresh.cancel(false);
                dispatcher.setTyping(chatIdentity, false);
            }
        }, durationMs, TimeUnit.MILLISECONDS);
    }

    public void stop(String chatIdentity) {
        ScheduledFuture<?> refresh = active.remove(chatIdentity);
        if (refresh != null) {
            refresh.cancel(false);
        }
        dispatcher.setTyping(chatIdentity, false);
    }

    public boolean isActive(String chatIdentity) {
        return active.containsKey(chatIdentity);
    }

    private ScheduledFuture<?> schedule(String chatIdentity) {
        ScheduledFuture<?> refresh = scheduler.scheduleAtFixedRate(
                () -> dispatcher.setTyping(chatIdentity, true),
                0, refreshIntervalMs, TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = active.put(chatIdentity, refresh);
        if (previous != null) {
            previous.cancel(false);
            log.trace("[Typing] Superseded indicator for {}", chatIdentity);
        }
        return refresh;
    }

    @PreDestroy
    public void shutdown() {
        active.values().forEach(future -> future.cancel(false));
        active.clear();
        scheduler.shutdownNow();
    }
}
