package com.cgi.dbsurveyor.collector.service;

import java.time.Duration;

/**
 * Blocking pause, replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Sleeper backed by {@link Thread#sleep(long)}.
     */
    Sleeper SYSTEM = duration -> {
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis());
        }
    };

    /**
     * Pauses the current thread.
     *
     * @param duration Pause length; zero or negative returns immediately
     * @throws InterruptedException If the thread is interrupted while waiting
     */
    void sleep(Duration duration) throws InterruptedException;
}
