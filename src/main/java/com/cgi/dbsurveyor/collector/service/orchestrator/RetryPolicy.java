package com.cgi.dbsurveyor.collector.service.orchestrator;

import com.cgi.dbsurveyor.collector.exception.BaseException;
import com.cgi.dbsurveyor.collector.exception.ConfigurationException;
import com.cgi.dbsurveyor.collector.service.Sleeper;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Random;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Bounded reconnect policy: a few attempts with exponential backoff plus random
 * jitter, abandoned as soon as the next wait would exceed the total time budget.
 * Only connection failures are retried.
 */
@Slf4j
@Getter
@Builder(toBuilder = true)
public final class RetryPolicy {

    @Builder.Default
    private final int maxAttempts = 3;

    @Builder.Default
    private final Duration initialBackoff = Duration.ofMillis(500);

    @Builder.Default
    private final Duration jitterMin = Duration.ofMillis(100);

    @Builder.Default
    private final Duration jitterMax = Duration.ofMillis(300);

    /**
     * Ceiling on the time spent retrying, measured from the first attempt.
     */
    @Builder.Default
    private final Duration maxTotal = Duration.ofSeconds(5);

    @Builder.Default
    private final Sleeper sleeper = Sleeper.SYSTEM;

    /**
     * Monotonic clock in nanoseconds.
     */
    @Builder.Default
    private final LongSupplier ticker = System::nanoTime;

    @Builder.Default
    private final Random random = new Random();

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    /**
     * Validates the policy.
     *
     * @throws ConfigurationException If a bound is out of range
     */
    public void validate() {
        if (maxAttempts < 1) {
            throw new ConfigurationException("Retry attempts must be at least 1");
        }
        if (initialBackoff.isNegative() || jitterMin.isNegative() || maxTotal.isNegative()) {
            throw new ConfigurationException("Retry durations cannot be negative");
        }
        if (jitterMax.compareTo(jitterMin) < 0) {
            throw new ConfigurationException("Retry jitter maximum must not be below its minimum");
        }
    }

    /**
     * Runs an action, retrying connection failures.
     *
     * @param operation Operation name for logging
     * @param action Action
     * @return Action result
     * @throws BaseException The last failure when retries are exhausted or not applicable
     */
    public <T> T execute(String operation, Supplier<T> action) {
        long start = ticker.getAsLong();
        int attempt = 1;
        while (true) {
            try {
                return action.get();
            } catch (BaseException e) {
                if (!e.isConnectionError() || attempt >= maxAttempts) {
                    throw e;
                }
                Duration wait = backoff(attempt);
                Duration elapsed = Duration.ofNanos(ticker.getAsLong() - start);
                if (elapsed.plus(wait).compareTo(maxTotal) > 0) {
                    log.debug("Retry budget for {} exhausted after {} attempts", operation, attempt);
                    throw e;
                }
                log.debug("Attempt {} of {} failed [{}], retrying in {} ms",
                        attempt, operation, e.getErrorCode(), wait.toMillis());
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
                attempt++;
            }
        }
    }

    /**
     * Wait before the next attempt: initial backoff doubled per failed attempt, plus jitter.
     *
     * @param failedAttempts Attempts made so far, starting at 1
     * @return Wait
     */
    Duration backoff(int failedAttempts) {
        Duration base = initialBackoff.multipliedBy(1L << Math.min(failedAttempts - 1, 20));
        long spread = jitterMax.toMillis() - jitterMin.toMillis();
        long jitter = jitterMin.toMillis() + (spread > 0 ? (long) (random.nextDouble() * (spread + 1)) : 0);
        return base.plusMillis(Math.min(jitter, jitterMax.toMillis()));
    }
}
