package com.micemail.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * MessageFormatter unit tests
 */
class MessageFormatterTest {

    @Test
    @DisplayName("Headers, blank line, body with CRLF line endings")
    void testFormat() {
        byte[] bytes = MessageFormatter.format(List.of("a@b.co", "c@d.co"), "Hi", "Body");

        assertThat(new String(bytes, StandardCharsets.UTF_8))
                .isEqualTo("To: a@b.co,c@d.co\r\nSubject: Hi\r\n\r\nBody\r\n");
    }

    @Test
    @DisplayName("Single recipient has no separator")
    void testSingleRecipient() {
        String text = new String(MessageFormatter.format(List.of("a@b.co"), "S", "B"), StandardCharsets.UTF_8);

        assertThat(text).startsWith("To: a@b.co\r\n");
    }

    @Test
    @DisplayName("Non-ASCII body is UTF-8 encoded")
    void testUtf8() {
        byte[] bytes = MessageFormatter.format(List.of("a@b.co"), "Grüße", "안녕하세요");

        assertThat(new String(bytes, StandardCharsets.UTF_8)).contains("Subject: Grüße\r\n").endsWith("안녕하세요\r\n");
    }

    @Test
    @DisplayName("Missing subject and body format as empty")
    void testNullSubjectAndBody() {
        String text = new String(MessageFormatter.format(List.of("a@b.co"), null, null), StandardCharsets.UTF_8);

        assertThat(text).isEqualTo("To: a@b.co\r\nSubject: \r\n\r\n\r\n");
    }
}
