package com.micemail.dispatch;

import com.micemail.relay.RelayException;
import lombok.Value;

import java.time.Duration;

/**
 * One failed send-once call within a dispatch
 */
@Value
public class DispatchAttempt {

    int attemptNumber;          // 1-based
    RelayException error;
    Duration backoffBefore;     // ZERO for the first attempt
}
