package com.micemail.dispatch;

import com.micemail.config.MicemailProperties;
import com.micemail.domain.OutboundMail;
import com.micemail.domain.RelayCredentials;
import com.micemail.relay.RelayClient;
import com.micemail.relay.RelayException;
import com.micemail.relay.RelayFailureReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;

/**
 * Relay dispatch with bounded retry
 * - Strictly sequential attempts per mail
 * - Exponential backoff (initial, x2, x4, ...) between attempts only
 * - Every relay failure is retried until the attempt budget is spent
 * - Blocking and Reactive (fire-and-forget) entry points
 */
@Slf4j
@Service
public class DispatchService {

    private final MicemailProperties properties;
    private final RelayClient relayClient;
    private final RelayCredentials credentials;
    private final List<DispatchListener> listeners;
    private final BackoffSleeper sleeper;

    @Autowired
    public DispatchService(MicemailProperties properties,
            RelayClient relayClient,
            RelayCredentials credentials,
            List<DispatchListener> listeners) {
        this(properties, relayClient, credentials, listeners, BackoffSleeper.THREAD_SLEEP);
    }

    DispatchService(MicemailProperties properties,
            RelayClient relayClient,
            RelayCredentials credentials,
            List<DispatchListener> listeners,
            BackoffSleeper sleeper) {
        this.properties = properties;
        this.relayClient = relayClient;
        this.credentials = credentials;
        this.listeners = List.copyOf(listeners);
        this.sleeper = sleeper;
    }

    /**
     * Deliver on the calling thread; returns once a terminal state is reached.
     */
    public DispatchOutcome dispatch(OutboundMail mail) {
        int maxAttempts = Math.max(1, properties.getDispatch().getMaxAttempts());
        Duration backoff = properties.getDispatch().getInitialBackoff();
        Duration backoffBefore = Duration.ZERO;
        Duration totalBackoff = Duration.ZERO;
        int failures = 0;

        while (true) {
            int attemptNumber = failures + 1;
            try {
                sendOnce(mail);
                DispatchOutcome outcome = DispatchOutcome.delivered(mail.getId(), attemptNumber, totalBackoff);
                notifyDelivered(outcome);
                return outcome;
            } catch (RelayException e) {
                failures++;
                if (failures >= maxAttempts) {
                    DispatchOutcome outcome = DispatchOutcome.exhausted(mail.getId(), attemptNumber, totalBackoff, e);
                    notifyExhausted(outcome);
                    return outcome;
                }

                notifyRetry(mail.getId(), new DispatchAttempt(attemptNumber, e, backoffBefore), backoff);
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("[{}] Interrupted during backoff, giving up after {} attempt(s)",
                            mail.getId(), attemptNumber);
                    DispatchOutcome outcome = DispatchOutcome.exhausted(mail.getId(), attemptNumber, totalBackoff, e);
                    notifyExhausted(outcome);
                    return outcome;
                }
                totalBackoff = totalBackoff.plus(backoff);
                backoffBefore = backoff;
                backoff = backoff.multipliedBy(2);
            }
        }
    }

    /**
     * Deliver on the bounded-elastic scheduler (Reactive)
     */
    public Mono<DispatchOutcome> dispatchAsync(OutboundMail mail) {
        return Mono.fromCallable(() -> dispatch(mail))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Fire-and-forget: the outcome is reported to listeners only
     */
    public void submit(OutboundMail mail) {
        log.info("[{}] Queued for background delivery to {}", mail.getId(), mail.getRecipients());
        dispatchAsync(mail)
                .doOnError(e -> log.error("[{}] Background dispatch failed", mail.getId(), e))
                .onErrorResume(e -> Mono.empty())
                .subscribe();
    }

    private void sendOnce(OutboundMail mail) throws RelayException {
        try {
            relayClient.sendOnce(credentials, mail.getRecipients(), mail.getContent());
        } catch (RuntimeException e) {
            throw new RelayException(RelayFailureReason.OTHER, String.valueOf(e.getMessage()), e);
        }
    }

    private void notifyRetry(String mailId, DispatchAttempt failed, Duration nextBackoff) {
        for (DispatchListener listener : listeners) {
            try {
                listener.onRetry(mailId, failed, nextBackoff);
            } catch (RuntimeException e) {
                log.error("Dispatch listener {} failed on retry", listener.getClass().getSimpleName(), e);
            }
        }
    }

    private void notifyDelivered(DispatchOutcome outcome) {
        for (DispatchListener listener : listeners) {
            try {
                listener.onDelivered(outcome);
            } catch (RuntimeException e) {
                log.error("Dispatch listener {} failed on delivered", listener.getClass().getSimpleName(), e);
            }
        }
    }

    private void notifyExhausted(DispatchOutcome outcome) {
        for (DispatchListener listener : listeners) {
            try {
                listener.onExhausted(outcome);
            } catch (RuntimeException e) {
                log.error("Dispatch listener {} failed on exhausted", listener.getClass().getSimpleName(), e);
            }
        }
    }
}
