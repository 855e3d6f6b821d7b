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
import me.golemcore.relay.domain.model.InboundMessage;

import java.util.List;

/**
 * Builds the XML-ish prompt blocks handed to the agent.
 */
public final class PromptFormatter {

    private PromptFormatter() {
    }

    /**
     * Missed-context block: one {@code <message>} element per message, in the
     * given order.
     */
    public static String formatMessages(List<InboundMessage> messages) {
        StringBuilder sb = new StringBuilder("<messages>\n");
        for (InboundMessage message : messages) {
            sb.append("<message sender=\"").append(escapeXml(message.getSenderName()))
                    .append("\" time=\"").append(message.getTimestamp())
                    .append("\">").append(escapeXml(message.getBody()))
                    .append("</message>\n");
        }
        return sb.append("</messages>").toString();
    }

    public static String formatEmail(IncomingEmail email) {
        return "<email>\n"
                + "<from>" + escapeXml(email.getFrom()) + "</from>\n"
                + "<subject>" + escapeXml(email.getSubject()) + "</subject>\n"
                + "<body>" + escapeXml(email.getBody()) + "</body>\n"
                + "</email>\n\n"
                + "Respond to this email. Your response will be sent as an email reply.";
    }

    public static String escapeXml(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }
}
