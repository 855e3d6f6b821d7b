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

import me.golemcore.relay.domain.model.IncomingEmail;
import me.golemcore.relay.domain.model.ProcessedEmailRecord;
import me.golemcore.relay.domain.model.RegisteredGroup;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.MailboxPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Answers polled emails through the agent, exactly once per email id.
 *
 * <p>
 * Every email gets a {@link ProcessedEmailRecord} before the agent runs. The
 * agent's reply is stored on the record before sending, so a failed send is
 * retried on the next poll without invoking the agent again. The email is
 * marked as read only after the reply went out.
 *
 * <p>
 * Emails are grouped into conversations by {@code relay.channels.email.context-mode}:
 * {@code thread} (one session per thread), {@code sender} (one per sender
 * address) or {@code single} (one shared session).
 */
@Service
@Slf4j
public class EmailChannelService {

    private static final String THREAD_PREFIX = "email-thread-";
    private static final String SENDER_PREFIX = "email-sender-";
    private static final String SINGLE_CONTEXT = "email-main";
    private static final int MAX_CONTEXT_ID_LENGTH = 100;
    private static final Pattern ANGLE_ADDRESS = Pattern.compile("<([^>]+)>");
    private static final String INSTRUCTIONS = "# Email conversation\n\n"
            + "Messages in this workspace arrive as emails. Your reply is sent back as a plain-text email "
            + "reply to the sender, so answer the email directly without chat formatting.\n";

    private final MailboxPort mailbox;
    private final ProcessedEmailService processedEmailService;
    private final GroupRegistrationService groupRegistrationService;
    private final AgentInvoker agentInvoker;
    private final RelayProperties properties;
    private final Clock clock;

    public EmailChannelService(MailboxPort mailbox, ProcessedEmailService processedEmailService,
            GroupRegistrationService groupRegistrationService, AgentInvoker agentInvoker,
            RelayProperties properties, Clock clock) {
        this.mailbox = mailbox;
        this.processedEmailService = processedEmailService;
        this.groupRegistrationService = groupRegistrationService;
        this.agentInvoker = agentInvoker;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Fetch and answer unread emails once. A failing email does not stop the
     * others.
     *
     * @return number of emails answered
     */
    public int pollOnce() {
        RelayProperties.EmailProperties config = properties.getChannels().getEmail();
        List<IncomingEmail> emails = mailbox.fetchUnread(config.getMaxResults());
        if (!emails.isEmpty()) {
            log.info("[Email] {} unread email(s) to process", emails.size());
        }
        int answered = 0;
        for (IncomingEmail email : emails) {
            try {
                if (handle(email)) {
                    answered++;
                }
            } catch (RuntimeException e) {
                log.error("[Email] Failed to process email {} from {}", email.getId(), email.getFrom(), e);
            }
        }
        return answered;
    }

    private boolean handle(IncomingEmail email) {
        Optional<ProcessedEmailRecord> existing = processedEmailService.find(email.getId());
        if (existing.isPresent() && existing.get().isResponded()) {
            mailbox.markHandled(email.getId());
            return false;
        }
        if (existing.isPresent() && existing.get().getReplyBody() != null) {
            log.info("[Email] Resending stored reply for {}", email.getId());
            deliver(email, existing.get().getReplyBody());
            return true;
        }

        processedEmailService.recordIfAbsent(ProcessedEmailRecord.builder()
                .id(email.getId())
                .threadId(email.getThreadId())
                .sender(email.getFrom())
                .subject(email.getSubject())
                .processedAt(clock.instant())
                .responded(false)
                .build());

        String contextKey = contextKey(email);
        groupRegistrationService.prepareEphemeralWorkspace(contextKey, INSTRUCTIONS);
        RegisteredGroup group = RegisteredGroup.builder()
                .name(contextKey)
                .folder(contextKey)
                .trigger("")
                .addedAt(clock.instant())
                .build();

        String reply = agentInvoker.invoke(group, ChatIdentities.email(bareAddress(email.getFrom())),
                PromptFormatter.formatEmail(email), false, true);
        if (reply == null || reply.isBlank()) {
            log.warn("[Email] Agent produced no reply for {}, marking handled", email.getId());
            processedEmailService.markResponded(email.getId());
            mailbox.markHandled(email.getId());
            return false;
        }

        processedEmailService.storeReply(email.getId(), reply);
        deliver(email, reply);
        return true;
    }

    private void deliver(IncomingEmail email, String reply) {
        String prefix = properties.getChannels().getEmail().getReplyPrefix();
        String body = prefix != null && !prefix.isEmpty() ? prefix + reply : reply;
        mailbox.sendReply(email, body);
        processedEmailService.markResponded(email.getId());
        mailbox.markHandled(email.getId());
        log.info("[Email] Replied to {} ({})", email.getFrom(), email.getId());
    }

    String contextKey(IncomingEmail email) {
        String mode = properties.getChannels().getEmail().getContextMode();
        if ("sender".equalsIgnoreCase(mode)) {
            String address = bareAddress(email.getFrom()).toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9.@-]", "");
            return SENDER_PREFIX + limit(address.replace("..", "."));
        }
        if ("single".equalsIgnoreCase(mode)) {
            return SINGLE_CONTEXT;
        }
        String thread = email.getThreadId() != null ? email.getThreadId() : email.getId();
        return THREAD_PREFIX + limit(thread.replaceAll("[^A-Za-z0-9-]", "_"));
    }

    /**
     * {@code Name <user@example.com>} to {@code user@example.com}.
     */
    public static String bareAddress(String from) {
        if (from == null) {
            return "";
        }
        Matcher matcher = ANGLE_ADDRESS.matcher(from);
        return matcher.find() ? matcher.group(1).trim() : from.trim();
    }

    private static String limit(String id) {
        return id.length() <= MAX_CONTEXT_ID_LENGTH ? id : id.substring(0, MAX_CONTEXT_ID_LENGTH);
    }
}
