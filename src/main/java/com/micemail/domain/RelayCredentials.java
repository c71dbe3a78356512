package com.micemail.domain;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Authenticated SMTP relay settings, immutable for the process lifetime
 */
@Value
@Builder
public class RelayCredentials {

    String senderAddress;
    @ToString.Exclude
    String password;
    String host;
    int port;
}
