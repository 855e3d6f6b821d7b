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

import jakarta.mail.BodyPart;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;

import java.io.IOException;
import java.util.regex.Pattern;

/**
 * Plain-text body of a MIME message. Plain text parts win over HTML;
 * attachments are ignored.
 */
final class MailTextExtractor {

    private static final int MAX_MULTIPART_DEPTH = 10;
    private static final Pattern BLOCK_TAGS = Pattern.compile("<(br|p|div|tr|li|h[1-6])[^>]*>",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern ALL_TAGS = Pattern.compile("<[^>]+>");
    private static final Pattern MULTI_NEWLINES = Pattern.compile("\n{3,}");
    private static final Pattern MULTI_SPACES = Pattern.compile(" {2,}");

    private MailTextExtractor() {
    }

    static String extractText(Part part) throws MessagingException, IOException {
        return extract(part, 0);
    }

    private static String extract(Part part, int depth) throws MessagingException, IOException {
        if (depth > MAX_MULTIPART_DEPTH) {
            return "";
        }
        if (part.isMimeType("text/plain")) {
            Object content = part.getContent();
            return content != null ? content.toString() : "";
        }
        if (part.isMimeType("text/html")) {
            Object content = part.getContent();
            return stripHtml(content != null ? content.toString() : "");
        }
        if (part.isMimeType("multipart/*")) {
            Multipart multipart = (Multipart) part.getContent();
            String plainText = null;
            String htmlText = null;
            for (int i = 0; i < multipart.getCount(); i++) {
                BodyPart bodyPart = multipart.getBodyPart(i);
                if (Part.ATTACHMENT.equalsIgnoreCase(bodyPart.getDisposition())) {
                    continue;
                }
                String nested = extract(bodyPart, depth + 1);
                if (bodyPart.isMimeType("text/html")) {
                    htmlText = htmlText == null ? nested : htmlText;
                } else if (plainText == null && !nested.isEmpty()) {
                    plainText = nested;
                }
            }
            if (plainText != null) {
                return plainText;
            }
            return htmlText != null ? htmlText : "";
        }
        return "";
    }

    static String stripHtml(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        String result = BLOCK_TAGS.matcher(html).replaceAll("\n");
        result = ALL_TAGS.matcher(result).replaceAll("");
        result = result
                .replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&amp;", "&");
        result = MULTI_NEWLINES.matcher(result).replaceAll("\n\n");
        result = MULTI_SPACES.matcher(result).replaceAll(" ");
        return result.strip();
    }
}
