package com.micemail.dispatch;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Dispatch counters for Prometheus
 */
@Component
public class MetricsDispatchListener implements DispatchListener {

    private final MeterRegistry meterRegistry;
    private final Counter deliveredCounter;

    public MetricsDispatchListener(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.deliveredCounter = Counter.builder("mail.dispatch.delivered")
                .description("Number of mails accepted by the relay")
                .register(meterRegistry);
    }

    @Override
    public void onRetry(String mailId, DispatchAttempt failed, Duration nextBackoff) {
        Counter.builder("mail.dispatch.retries")
                .description("Number of failed relay attempts that were retried")
                .tag("reason", failed.getError().getReason().name())
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void onDelivered(DispatchOutcome outcome) {
        deliveredCounter.increment();
    }

    @Override
    public void onExhausted(DispatchOutcome outcome) {
        Counter.builder("mail.dispatch.exhausted")
                .description("Number of mails dropped after the retry budget ran out")
                .tag("reason", outcome.getLastError().getReason().name())
                .register(meterRegistry)
                .increment();
    }
}
