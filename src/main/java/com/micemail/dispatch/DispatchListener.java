package com.micemail.dispatch;

import java.time.Duration;

/**
 * Observability sink for dispatch progress.
 * <p>
 * For one dispatch: {@code onRetry} once per failed attempt that will be
 * retried, then exactly one of {@code onDelivered} or {@code onExhausted}.
 * In ASYNC mode these callbacks are the only place the outcome surfaces.
 */
public interface DispatchListener {

    default void onRetry(String mailId, DispatchAttempt failed, Duration nextBackoff) {
    }

    default void onDelivered(DispatchOutcome outcome) {
    }

    default void onExhausted(DispatchOutcome outcome) {
    }
}
