// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.convergence;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.time.Duration;

/**
 * The limits of a poll. Either bound may be absent, but a poll without any bound falls back to the poller's
 * default timeout.
 *
 * @param maxAttempts the maximum number of predicate evaluations, {@link #UNLIMITED_ATTEMPTS} if unbounded
 * @param timeout     the wall-clock timeout, or {@code null} if unbounded
 */
public record PollBounds(long maxAttempts, @Nullable Duration timeout) {

    public static final long UNLIMITED_ATTEMPTS = Long.MAX_VALUE;

    private static final PollBounds UNBOUNDED = new PollBounds(UNLIMITED_ATTEMPTS, null);

    public PollBounds {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive, but was " + maxAttempts);
        }
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("timeout must be positive, but was " + timeout);
        }
    }

    @NonNull
    public static PollBounds attempts(final long maxAttempts) {
        return new PollBounds(maxAttempts, null);
    }

    @NonNull
    public static PollBounds timeout(@NonNull final Duration timeout) {
        return new PollBounds(UNLIMITED_ATTEMPTS, requireNonNull(timeout));
    }

    @NonNull
    public static PollBounds of(final long maxAttempts, @NonNull final Duration timeout) {
        return new PollBounds(maxAttempts, requireNonNull(timeout));
    }

    @NonNull
    public static PollBounds unbounded() {
        return UNBOUNDED;
    }

    public boolean limitsAttempts() {
        return maxAttempts != UNLIMITED_ATTEMPTS;
    }

    /**
     * Returns these bounds with the given timeout applied if neither bound is set.
     *
     * @param defaultTimeout the ceiling for unbounded polls
     * @return bounds that limit at least one of attempts and time
     */
    @NonNull
    public PollBounds orDefaultTimeout(@NonNull final Duration defaultTimeout) {
        requireNonNull(defaultTimeout);
        return limitsAttempts() || timeout != null ? this : timeout(defaultTimeout);
    }
}
