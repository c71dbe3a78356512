package com.micemail.relay;

import lombok.Getter;

/**
 * One failed send-once call against the relay
 */
@Getter
public class RelayException extends Exception {

    private final RelayFailureReason reason;

    public RelayException(RelayFailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RelayException(RelayFailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
