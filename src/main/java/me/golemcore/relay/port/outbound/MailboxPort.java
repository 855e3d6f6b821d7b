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

package me.golemcore.relay.port.outbound;

import me.golemcore.relay.domain.model.IncomingEmail;

import java.util.List;

/**
 * Polled mailbox used by the email channel.
 */
public interface MailboxPort {

    /**
     * Unread emails matching the configured trigger, oldest first. Fetching does
     * not change the read state.
     */
    List<IncomingEmail> fetchUnread(int maxResults);

    /**
     * Reply in the thread of the given email.
     */
    void sendReply(IncomingEmail original, String body);

    /**
     * Send a fresh email that is not a reply.
     */
    void sendMessage(String to, String subject, String body);

    /**
     * Mark an email as read so it is not fetched again.
     */
    void markHandled(String emailId);
}
