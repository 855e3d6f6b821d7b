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


package me.golemcore.relay.adapter.inbound.email;

import me.golemcore.relay.domain.service.ChatIdentities;
import me.golemcore.relay.domain.service.EmailChannelService;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.inbound.ChannelPort;
import me.golemcore.relay.port.outbound.MailboxPort;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Email channel. Polls the mailbox every
 * {@code relay.channels.email.poll-interval-ms} and lets
 * {@link EmailChannelService} answer what it finds. Outbound text for
 * {@code email:} identities that is not a reply goes out as a fresh email.
 */
@Component
@Slf4j
public class EmailChannelAdapter implements ChannelPort {

    private static final int EMAIL_MAX_MESSAGE_LENGTH = 100_000;

    private final EmailChannelService emailChannelService;
    private final MailboxPort mailbox;
    private final RelayProperties properties;
    private final AtomicBoolean polling = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public EmailChannelAdapter(EmailChannelService emailChannelService, MailboxPort mailbox,
            RelayProperties properties) {
        this.emailChannelService = emailChannelService;
        this.mailbox = mailbox;
        this.properties = properties;
    }

    @Override
    public String getChannelType() {
        return ChatIdentities.EMAIL;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                return;
            }
            RelayProperties.EmailProperties config = properties.getChannels().getEmail();
            if (!config.isEnabled()) {
                log.info("[Email] Channel disabled");
                return;
            }
            long interval = config.getPollIntervalMs();
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "email-poller");
                t.setDaemon(true);
                return t;
            });
            scheduler.scheduleWithFixedDelay(this::poll, 0, interval, TimeUnit.MILLISECONDS);
            running = true;
            log.info("[Email] Polling {} every {}ms (trigger: {}={})", config.getImap().getHost(), interval,
                    config.getTriggerMode(), config.getTriggerValue());
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("[Email] Stopped");
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getMaxMessageLength() {
        return EMAIL_MAX_MESSAGE_LENGTH;
    }

    @Override
    public CompletableFuture<Void> sendMessage(String chatIdentity, String content) {
        return CompletableFuture.runAsync(() -> mailbox.sendMessage(ChatIdentities.nativeId(chatIdentity),
                "Message from " + properties.getAssistantName(), content));
    }

    void poll() {
        if (!polling.compareAndSet(false, true)) {
            log.debug("[Email] Previous poll still running, skipping");
            return;
        }
        try {
            emailChannelService.pollOnce();
        } catch (RuntimeException e) {
            log.error("[Email] Poll failed: {}", e.getMessage(), e);
        } finally {
            polling.set(false);
        }
    }
}
