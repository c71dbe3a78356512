package com.micemail.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * OutboundMail unit tests
 */
class OutboundMailTest {

    private static final byte[] MESSAGE = "To: a@b.co\r\nSubject: Hi\r\n\r\nBody\r\n".getBytes(StandardCharsets.UTF_8);

    @Test
    @DisplayName("Changing the returned content does not change the mail")
    void testGetContentReturnsCopy() {
        OutboundMail mail = OutboundMail.builder().id("m1").recipient("a@b.co").content(MESSAGE).build();

        mail.getContent()[0] = 'X';

        assertThat(mail.getContent()).isEqualTo(MESSAGE);
    }

    @Test
    @DisplayName("Changing the builder input after build does not change the mail")
    void testBuilderCopiesContent() {
        byte[] source = MESSAGE.clone();
        OutboundMail mail = OutboundMail.builder().id("m1").recipient("a@b.co").content(source).build();

        source[0] = 'X';

        assertThat(mail.getContent()).isEqualTo(MESSAGE);
    }
}
