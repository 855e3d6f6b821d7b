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

package me.golemcore.relay.adapter.outbound.mail;

import me.golemcore.relay.domain.model.IncomingEmail;
import me.golemcore.relay.domain.service.EmailChannelService;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.MailboxException;
import me.golemcore.relay.port.outbound.MailboxPort;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.Transport;
import jakarta.mail.UIDFolder;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.search.AndTerm;
import jakarta.mail.search.FlagTerm;
import jakarta.mail.search.RecipientStringTerm;
import jakarta.mail.search.SearchTerm;
import jakarta.mail.search.SubjectTerm;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * IMAP/SMTP mailbox for the email channel.
 *
 * <p>
 * Trigger modes select what counts as addressed to the assistant:
 * <ul>
 * <li>{@code label} - unread mail in the IMAP folder named by the trigger
 * value</li>
 * <li>{@code address} - unread mail in INBOX sent to the trigger address</li>
 * <li>{@code subject} - unread mail in INBOX whose subject contains the
 * trigger value</li>
 * </ul>
 * Email ids are Message-ID headers, falling back to the IMAP UID.
 */
@Component
@Slf4j
@SuppressWarnings({ "PMD.CloseResource", "PMD.ReplaceJavaUtilDate" })
public class ImapMailboxAdapter implements MailboxPort {

    private static final String INBOX = "INBOX";
    private static final String UID_PREFIX = "uid-";
    private static final String REPLY_PREFIX = "Re: ";

    private final RelayProperties properties;
    private final Map<String, Long> uidsById = new ConcurrentHashMap<>();

    public ImapMailboxAdapter(RelayProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<IncomingEmail> fetchUnread(int maxResults) {
        RelayProperties.EmailProperties config = properties.getChannels().getEmail();
        try (Store store = connectStore()) {
            Folder folder = store.getFolder(folderName());
            if (!folder.exists()) {
                log.warn("[Email] Folder not found: {}", folderName());
                return List.of();
            }
            folder.open(Folder.READ_ONLY);
            try {
                UIDFolder uidFolder = (UIDFolder) folder;
                Message[] found = folder.search(searchTerm(config));
                List<Message> messages = new ArrayList<>(Arrays.asList(found));
                messages.sort(Comparator.comparingInt(Message::getMessageNumber));

                List<IncomingEmail> emails = new ArrayList<>();
                for (Message message : messages.subList(0, Math.min(maxResults, messages.size()))) {
                    IncomingEmail email = toEmail((MimeMessage) message, uidFolder.getUID(message),
                            config.getMaxBodyLength());
                    uidsById.put(email.getId(), uidFolder.getUID(message));
                    emails.add(email);
                }
                return emails;
            } finally {
                folder.close(false);
            }
        } catch (MessagingException | IOException e) {
            throw new MailboxException("Failed to fetch unread mail", e);
        }
    }

    @Override
    public void sendReply(IncomingEmail original, String body) {
        String subject = original.getSubject() != null ? original.getSubject() : "";
        if (!subject.toLowerCase(Locale.ROOT).startsWith("re:")) {
            subject = REPLY_PREFIX + subject;
        }
        try {
            MimeMessage message = newMessage(EmailChannelService.bareAddress(original.getFrom()), subject, body);
            if (original.getMessageId() != null) {
                message.setHeader("In-Reply-To", original.getMessageId());
                String references = original.getReferences();
                message.setHeader("References", references != null && !references.isBlank()
                        ? references + " " + original.getMessageId()
                        : original.getMessageId());
            }
            deliver(message);
            log.info("[Email] Reply sent to {}", original.getFrom());
        } catch (MessagingException e) {
            throw new MailboxException("Failed to send reply to " + original.getFrom(), e);
        }
    }

    @Override
    public void sendMessage(String to, String subject, String body) {
        try {
            deliver(newMessage(to, subject, body));
            log.info("[Email] Message sent to {}", to);
        } catch (MessagingException e) {
            throw new MailboxException("Failed to send message to " + to, e);
        }
    }

    @Override
    public void markHandled(String emailId) {
        Long uid = uidsById.get(emailId);
        if (uid == null && emailId.startsWith(UID_PREFIX)) {
            uid = Long.parseLong(emailId.substring(UID_PREFIX.length()));
        }
        if (uid == null) {
            log.warn("[Email] Cannot mark {} as read: message not seen in this session", emailId);
            return;
        }
        try (Store store = connectStore()) {
            Folder folder = store.getFolder(folderName());
            folder.open(Folder.READ_WRITE);
            try {
                Message message = ((UIDFolder) folder).getMessageByUID(uid);
                if (message != null) {
                    message.setFlag(Flags.Flag.SEEN, true);
                }
            } finally {
                folder.close(false);
            }
            uidsById.remove(emailId);
        } catch (MessagingException e) {
            throw new MailboxException("Failed to mark " + emailId + " as read", e);
        }
    }

    protected void deliver(MimeMessage message) throws MessagingException {
        Transport.send(message);
    }

    Store connectStore() throws MessagingException {
        RelayProperties.MailServerProperties imap = properties.getChannels().getEmail().getImap();
        Session session = MailSessionFactory.createImapSession(imap);
        Store store = session.getStore(MailSessionFactory.imapProtocol(MailSecurity.fromString(imap.getSecurity())));
        store.connect(imap.getHost(), imap.getPort(), imap.getUsername(), imap.getPassword());
        return store;
    }

    private MimeMessage newMessage(String to, String subject, String body) throws MessagingException {
        RelayProperties.MailServerProperties smtp = properties.getChannels().getEmail().getSmtp();
        MimeMessage message = new MimeMessage(MailSessionFactory.createSmtpSession(smtp));
        message.setFrom(new InternetAddress(smtp.getUsername()));
        message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(to));
        message.setSubject(subject, StandardCharsets.UTF_8.name());
        message.setText(body, StandardCharsets.UTF_8.name());
        message.setSentDate(new Date());
        return message;
    }

    private String folderName() {
        RelayProperties.EmailProperties config = properties.getChannels().getEmail();
        return "label".equalsIgnoreCase(config.getTriggerMode()) ? config.getTriggerValue() : INBOX;
    }

    private SearchTerm searchTerm(RelayProperties.EmailProperties config) {
        SearchTerm unseen = new FlagTerm(new Flags(Flags.Flag.SEEN), false);
        String mode = config.getTriggerMode() != null ? config.getTriggerMode().toLowerCase(Locale.ROOT) : "label";
        return switch (mode) {
        case "address" -> new AndTerm(unseen, new RecipientStringTerm(Message.RecipientType.TO,
                config.getTriggerValue()));
        case "subject" -> new AndTerm(unseen, new SubjectTerm(config.getTriggerValue()));
        default -> unseen;
        };
    }

    private IncomingEmail toEmail(MimeMessage message, long uid, int maxBodyLength)
            throws MessagingException, IOException {
        String messageId = message.getMessageID();
        String references = header(message, "References");
        String inReplyTo = header(message, "In-Reply-To");
        String body = MailTextExtractor.extractText(message);
        if (body.length() > maxBodyLength) {
            body = body.substring(0, maxBodyLength);
        }
        Date received = message.getReceivedDate() != null ? message.getReceivedDate() : message.getSentDate();

        return IncomingEmail.builder()
                .id(messageId != null ? messageId : UID_PREFIX + uid)
                .threadId(threadRoot(references, inReplyTo, messageId))
                .messageId(messageId)
                .references(references)
                .from(message.getFrom() != null && message.getFrom().length > 0
                        ? ((InternetAddress) message.getFrom()[0]).toUnicodeString()
                        : "")
                .subject(message.getSubject())
                .body(body)
                .receivedAt(received != null ? received.toInstant() : null)
                .build();
    }

    /**
     * The first Message-ID of the References chain identifies the thread.
     */
    static String threadRoot(String references, String inReplyTo, String messageId) {
        if (references != null && !references.isBlank()) {
            return references.trim().split("\\s+")[0];
        }
        if (inReplyTo != null && !inReplyTo.isBlank()) {
            return inReplyTo.trim();
        }
        return messageId;
    }

    private static String header(Message message, String name) throws MessagingException {
        String[] values = message.getHeader(name);
        return values != null && values.length > 0 ? values[0] : null;
    }
}
