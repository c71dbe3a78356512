package com.micemail.dispatch;

import java.time.Duration;

/**
 * Suspends the dispatching thread between attempts
 */
@FunctionalInterface
public interface BackoffSleeper {

    BackoffSleeper THREAD_SLEEP = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
