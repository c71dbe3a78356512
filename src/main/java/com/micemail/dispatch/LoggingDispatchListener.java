package com.micemail.dispatch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Slf4j
@Component
public class LoggingDispatchListener implements DispatchListener {

    @Override
    public void onRetry(String mailId, DispatchAttempt failed, Duration nextBackoff) {
        log.warn("[{}] Attempt {} failed ({}: {}), retrying in {}ms",
                mailId, failed.getAttemptNumber(), failed.getError().getReason(),
                failed.getError().getMessage(), nextBackoff.toMillis());
    }

    @Override
    public void onDelivered(DispatchOutcome outcome) {
        log.info("[{}] Delivered to relay after {} attempt(s)", outcome.getMailId(), outcome.getAttempts());
    }

    @Override
    public void onExhausted(DispatchOutcome outcome) {
        log.error("[{}] Failed to send email after {} attempts. Last error ({}): {}",
                outcome.getMailId(), outcome.getAttempts(),
                outcome.getLastError().getReason(), outcome.getLastError().getMessage());
    }
}
