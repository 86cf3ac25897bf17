// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.convergence;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.time.Duration;
import java.util.concurrent.locks.Lock;
import java.util.function.BooleanSupplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.harness.config.HarnessConfig;
import org.hiero.harness.time.Time;

/**
 * Repeatedly evaluates a predicate until it holds or the poll's bounds are exhausted.
 *
 * <p>Only a {@code false} answer is retried. An exception thrown by the predicate ends the poll immediately with
 * {@link PollOutcome#HARD_FAILED}.
 */
public class ConvergencePoller {

    private static final Logger log = LogManager.getLogger(ConvergencePoller.class);

    private final Time time;
    private final Duration interval;
    private final Duration defaultTimeout;

    /**
     * Creates a new poller.
     *
     * @param time           the time source used for sleeping and measuring timeouts
     * @param interval       the pause after each unsuccessful evaluation
     * @param defaultTimeout the timeout applied to polls without any bound
     */
    public ConvergencePoller(
            @NonNull final Time time, @NonNull final Duration interval, @NonNull final Duration defaultTimeout) {
        this.time = requireNonNull(time);
        this.interval = requireNonNull(interval);
        this.defaultTimeout = requireNonNull(defaultTimeout);
        if (interval.isNegative()) {
            throw new IllegalArgumentException("interval must not be negative");
        }
        if (defaultTimeout.isZero() || defaultTimeout.isNegative()) {
            throw new IllegalArgumentException("defaultTimeout must be positive");
        }
    }

    /**
     * Creates a poller on the OS clock using the configured interval and default timeout.
     *
     * @param config the harness configuration
     * @return the poller
     */
    @NonNull
    public static ConvergencePoller create(@NonNull final HarnessConfig config) {
        return new ConvergencePoller(Time.getCurrent(), config.pollInterval(), config.defaultTimeout());
    }

    /**
     * Returns a poller sharing this poller's time source and default timeout, pausing for the given interval.
     *
     * @param interval the pause after each unsuccessful evaluation
     * @return the poller
     */
    @NonNull
    public ConvergencePoller withInterval(@NonNull final Duration interval) {
        return new ConvergencePoller(time, interval, defaultTimeout);
    }

    @NonNull
    public Time time() {
        return time;
    }

    @NonNull
    public Duration interval() {
        return interval;
    }

    @NonNull
    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    /**
     * Polls the predicate within the given bounds.
     *
     * @param predicate the condition to wait for
     * @param bounds    the limits of the poll
     * @return the result of the poll
     */
    @NonNull
    public PollResult poll(@NonNull final BooleanSupplier predicate, @NonNull final PollBounds bounds) {
        return poll(predicate, bounds, null);
    }

    /**
     * Polls the predicate within the given bounds, holding the given lock during each evaluation.
     *
     * @param predicate the condition to wait for
     * @param bounds    the limits of the poll
     * @param lock      the lock guarding the predicate's own state, or {@code null}
     * @return the result of the poll
     * @throws IllegalStateException if the thread is interrupted while pausing between evaluations
     */
    @NonNull
    public PollResult poll(
            @NonNull final BooleanSupplier predicate, @NonNull final PollBounds bounds, @Nullable final Lock lock) {
        requireNonNull(predicate);
        final PollBounds effective = requireNonNull(bounds).orDefaultTimeout(defaultTimeout);
        final long start = time.nanoTime();
        final long timeoutNanos =
                effective.timeout() == null ? Long.MAX_VALUE : effective.timeout().toNanos();

        long attempts = 0;
        while (attempts < effective.maxAttempts() && time.nanoTime() - start < timeoutNanos) {
            final boolean satisfied;
            try {
                satisfied = evaluate(predicate, lock);
            } catch (final RuntimeException e) {
                attempts++;
                log.debug("Predicate failed on attempt {}", attempts, e);
                return PollResult.hardFailed(attempts, elapsedSince(start), e);
            }
            attempts++;
            if (satisfied) {
                log.debug("Predicate satisfied after {} attempt(s)", attempts);
                return PollResult.converged(attempts, elapsedSince(start));
            }
            pause();
        }

        final ExhaustedBound bound =
                attempts >= effective.maxAttempts() ? ExhaustedBound.ATTEMPTS : ExhaustedBound.TIMEOUT;
        log.debug("Predicate not satisfied, {} bound exhausted after {} attempt(s)", bound, attempts);
        return PollResult.timedOut(attempts, elapsedSince(start), bound);
    }

    /**
     * Waits until the predicate holds, bounded only by the default timeout.
     *
     * @param predicate the condition to wait for
     * @throws ConvergenceTimeoutException if the default timeout elapsed
     */
    public void waitUntil(@NonNull final BooleanSupplier predicate) {
        waitUntil(predicate, PollBounds.unbounded());
    }

    /**
     * Waits until the predicate holds.
     *
     * @param predicate the condition to wait for
     * @param bounds    the limits of the wait
     * @throws ConvergenceTimeoutException if a bound was exhausted
     */
    public void waitUntil(@NonNull final BooleanSupplier predicate, @NonNull final PollBounds bounds) {
        waitUntil(predicate, bounds, null);
    }

    /**
     * Waits until the predicate holds, holding the given lock during each evaluation.
     *
     * @param predicate the condition to wait for
     * @param bounds    the limits of the wait
     * @param lock      the lock guarding the predicate's own state, or {@code null}
     * @throws ConvergenceTimeoutException if a bound was exhausted
     */
    public void waitUntil(
            @NonNull final BooleanSupplier predicate, @NonNull final PollBounds bounds, @Nullable final Lock lock) {
        poll(predicate, bounds, lock).orThrow("Condition not met");
    }

    private static boolean evaluate(@NonNull final BooleanSupplier predicate, @Nullable final Lock lock) {
        if (lock == null) {
            return predicate.getAsBoolean();
        }
        lock.lock();
        try {
            return predicate.getAsBoolean();
        } finally {
            lock.unlock();
        }
    }

    private void pause() {
        if (interval.isZero()) {
            return;
        }
        try {
            time.sleep(interval);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while polling", e);
        }
    }

    @NonNull
    private Duration elapsedSince(final long start) {
        return Duration.ofNanos(time.nanoTime() - start);
    }
}
