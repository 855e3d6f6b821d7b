package me.golemcore.relay.domain.service;

import me.golemcore.relay.domain.model.InboundMessage;
import me.golemcore.relay.domain.model.IncomingEmail;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PromptFormatterTest {

    @Test
    void shouldFormatMessagesInOrderWithEscaping() {
        InboundMessage first = InboundMessage.builder()
                .senderName("Alice")
                .body("is 2 < 3 & 4 > 1?")
                .timestamp(Instant.parse("2026-03-01T10:00:00Z"))
                .build();
        InboundMessage second = InboundMessage.builder()
                .senderName("Bob \"B\"")
                .body("@bot answer")
                .timestamp(Instant.parse("2026-03-01T10:01:00Z"))
                .build();

        String prompt = PromptFormatter.formatMessages(List.of(first, second));

        assertEquals("<messages>\n"
                + "<message sender=\"Alice\" time=\"2026-03-01T10:00:00Z\">is 2 &lt; 3 &amp; 4 &gt; 1?</message>\n"
                + "<message sender=\"Bob &quot;B&quot;\" time=\"2026-03-01T10:01:00Z\">@bot answer</message>\n"
                + "</messages>", prompt);
    }

    @Test
    void shouldWrapEmailInEscapedBlock() {
        IncomingEmail email = IncomingEmail.builder()
                .from("Alice <alice@example.com>")
                .subject("Plans")
                .body("See you at 5")
                .build();

        String prompt = PromptFormatter.formatEmail(email);

        assertTrue(prompt.startsWith("<email>\n<from>Alice &lt;alice@example.com&gt;</from>\n"));
        assertTrue(prompt.contains("<subject>Plans</subject>"));
        assertTrue(prompt.contains("<body>See you at 5</body>"));
    }

    @Test
    void shouldTreatNullAsEmpty() {
        assertEquals("", PromptFormatter.escapeXml(null));
    }
}
