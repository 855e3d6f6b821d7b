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

import me.golemcore.relay.domain.model.ChannelConnectedEvent;
import me.golemcore.relay.domain.model.GroupMetadataEvent;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Keeps group chat names fresh. A sync asks every channel to report its groups
 * and is skipped while the previous one is younger than
 * {@code relay.groups.sync-interval-ms}, unless forced.
 */
@Service
@Slf4j
public class GroupMetadataService {

    private final OutboundDispatcher dispatcher;
    private final ChatHistoryService chatHistoryService;
    private final RelayProperties properties;
    private final Clock clock;

    private ScheduledExecutorService scheduler;

    public GroupMetadataService(OutboundDispatcher dispatcher, ChatHistoryService chatHistoryService,
            RelayProperties properties, Clock clock) {
        this.dispatcher = dispatcher;
        this.chatHistoryService = chatHistoryService;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        long interval = properties.getGroups().getSyncIntervalMs();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "group-metadata-sync");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::scheduledSync, interval, interval, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    public void shutdown() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    /**
     * @return true if a sync was requested
     */
    public synchronized boolean sync(boolean force) {
        Instant now = clock.instant();
        Optional<Instant> last = chatHistoryService.getLastGroupSync();
        if (!force && last.isPresent()
                && last.get().plusMillis(properties.getGroups().getSyncIntervalMs()).isAfter(now)) {
            log.debug("[Groups] Metadata sync skipped, last sync at {}", last.get());
            return false;
        }
        dispatcher.requestGroupSync();
        chatHistoryService.setLastGroupSync(now);
        log.info("[Groups] Group metadata sync requested (force={})", force);
        return true;
    }

    @EventListener
    public void onChannelConnected(ChannelConnectedEvent event) {
        sync(false);
    }

    @EventListener
    public void onGroupMetadata(GroupMetadataEvent event) {
        chatHistoryService.updateChatNames(event.chats());
        log.info("[Groups] {} reported {} group(s)", event.channelType(), event.chats().size());
    }

    private void scheduledSync() {
        try {
            sync(false);
        } catch (RuntimeException e) {
            log.error("[Groups] Scheduled metadata sync failed", e);
        }
    }
}
