package com.micemail.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Formatted message ready for the relay
 */
@Value
@Builder
public class OutboundMail {

    String id;
    @Singular
    List<String> recipients;
    byte[] content;

    /**
     * Copy of the message bytes; the same content is resent on every attempt.
     */
    public byte[] getContent() {
        return content == null ? null : content.clone();
    }

    public static String newId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static class OutboundMailBuilder {

        public OutboundMailBuilder content(byte[] content) {
            this.content = content == null ? null : content.clone();
            return this;
        }
    }
}
