package com.micemail.util;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Builds the wire-ready RFC 5322 message handed to the relay
 */
public final class MessageFormatter {

    private static final String CRLF = "\r\n";

    private MessageFormatter() {}

    /**
     * To/Subject header block, blank line, body. CRLF line endings, UTF-8.
     */
    public static byte[] format(List<String> recipients, String subject, String body) {
        StringBuilder sb = new StringBuilder();
        sb.append("To: ").append(String.join(",", recipients)).append(CRLF);
        sb.append("Subject: ").append(subject == null ? "" : subject).append(CRLF);
        sb.append(CRLF);
        sb.append(body == null ? "" : body).append(CRLF);
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }
}
