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

import me.golemcore.relay.domain.model.InboundMessage;
import me.golemcore.relay.domain.model.RegisteredGroup;
import me.golemcore.relay.domain.state.RouterState;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Decides who may do what, using only the current router state.
 *
 * <p>
 * Inbound messages may invoke the agent only from a registered chat, and only
 * when the group auto-responds or the body starts with the group's trigger
 * word. Commands from the sandbox may act on a target group only when they come
 * from the privileged group or from the target's own folder.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthorizationService {

    private final RouterState routerState;
    private final RelayProperties properties;

    private final Map<String, Pattern> triggerPatterns = new ConcurrentHashMap<>();

    /**
     * Group the message may invoke, if it is eligible at all.
     */
    public Optional<RegisteredGroup> eligibleGroup(InboundMessage message) {
        Optional<RegisteredGroup> group = routerState.findGroup(message.getChatIdentity());
        if (group.isEmpty()) {
            return Optional.empty();
        }
        return matchesTrigger(group.get(), message.getBody()) ? group : Optional.empty();
    }

    public boolean matchesTrigger(RegisteredGroup group, String body) {
        if (group.isAutoRespond()) {
            return true;
        }
        if (body == null) {
            return false;
        }
        Pattern pattern = triggerPatterns.computeIfAbsent(group.getTrigger(),
                trigger -> Pattern.compile("^" + Pattern.quote(trigger) + "\\b", Pattern.CASE_INSENSITIVE));
        return pattern.matcher(body.trim()).find();
    }

    public boolean isPrivileged(String folder) {
        return properties.getMainGroupFolder().equals(folder);
    }

    /**
     * Whether a command read from {@code sourceFolder}'s mailbox may act on
     * {@code targetFolder}.
     */
    public boolean canActOn(String sourceFolder, String targetFolder) {
        return isPrivileged(sourceFolder) || (targetFolder != null && targetFolder.equals(sourceFolder));
    }

    /**
     * Whether a command read from {@code sourceFolder}'s mailbox may address
     * {@code chatIdentity}. Unregistered chats are reachable only from the
     * privileged group.
     */
    public boolean canAddressChat(String sourceFolder, String chatIdentity) {
        if (isPrivileged(sourceFolder)) {
            return true;
        }
        return routerState.findGroup(chatIdentity)
                .map(group -> sourceFolder.equals(group.getFolder()))
                .orElse(false);
    }
}
