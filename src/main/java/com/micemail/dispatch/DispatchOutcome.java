package com.micemail.dispatch;

import com.micemail.relay.RelayException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Terminal result of a dispatch, produced exactly once
 */
@Value
@Builder
public class DispatchOutcome {

    String mailId;
    DispatchStatus status;
    int attempts;
    Duration totalBackoff;
    RelayException lastError;

    public boolean isDelivered() {
        return status == DispatchStatus.DELIVERED;
    }

    static DispatchOutcome delivered(String mailId, int attempts, Duration totalBackoff) {
        return DispatchOutcome.builder()
                .mailId(mailId)
                .status(DispatchStatus.DELIVERED)
                .attempts(attempts)
                .totalBackoff(totalBackoff)
                .build();
    }

    static DispatchOutcome exhausted(String mailId, int attempts, Duration totalBackoff, RelayException lastError) {
        return DispatchOutcome.builder()
                .mailId(mailId)
                .status(DispatchStatus.EXHAUSTED)
                .attempts(attempts)
                .totalBackoff(totalBackoff)
                .lastError(lastError)
                .build();
    }
}
