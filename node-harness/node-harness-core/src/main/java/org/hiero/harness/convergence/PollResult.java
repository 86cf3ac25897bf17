// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.convergence;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * The result of a poll.
 *
 * @param outcome  how the poll ended
 * @param attempts the number of predicate evaluations
 * @param elapsed  the time the poll took
 * @param bound    the exhausted bound if the poll timed out, {@code null} otherwise
 * @param failure  the exception thrown by the predicate if the poll hard-failed, {@code null} otherwise
 */
public record PollResult(
        @NonNull PollOutcome outcome,
        long attempts,
        @NonNull Duration elapsed,
        @Nullable ExhaustedBound bound,
        @Nullable RuntimeException failure) {

    public PollResult {
        requireNonNull(outcome, "outcome must not be null");
        requireNonNull(elapsed, "elapsed must not be null");
        if ((outcome == PollOutcome.TIMED_OUT) != (bound != null)) {
            throw new IllegalArgumentException("An exhausted bound must be given exactly for timed out polls");
        }
        if ((outcome == PollOutcome.HARD_FAILED) != (failure != null)) {
            throw new IllegalArgumentException("A failure must be given exactly for hard failed polls");
        }
    }

    @NonNull
    static PollResult converged(final long attempts, @NonNull final Duration elapsed) {
        return new PollResult(PollOutcome.CONVERGED, attempts, elapsed, null, null);
    }

    @NonNull
    static PollResult timedOut(final long attempts, @NonNull final Duration elapsed, @NonNull final ExhaustedBound bound) {
        return new PollResult(PollOutcome.TIMED_OUT, attempts, elapsed, requireNonNull(bound), null);
    }

    @NonNull
    static PollResult hardFailed(
            final long attempts, @NonNull final Duration elapsed, @NonNull final RuntimeException failure) {
        return new PollResult(PollOutcome.HARD_FAILED, attempts, elapsed, null, requireNonNull(failure));
    }

    public boolean converged() {
        return outcome == PollOutcome.CONVERGED;
    }

    /**
     * Returns normally if the poll converged and throws otherwise.
     *
     * @param description what was awaited
     * @throws ConvergenceTimeoutException if a bound was exhausted
     * @throws RuntimeException            the predicate's own exception if the poll hard-failed
     */
    public void orThrow(@NonNull final String description) {
        orThrow(description, () -> "predicate not satisfied");
    }

    /**
     * Returns normally if the poll converged and throws otherwise.
     *
     * @param description   what was awaited
     * @param observedState supplies the last observed state for the timeout message
     * @throws ConvergenceTimeoutException if a bound was exhausted
     * @throws RuntimeException            the predicate's own exception if the poll hard-failed
     */
    public void orThrow(@NonNull final String description, @NonNull final Supplier<String> observedState) {
        requireNonNull(description);
        requireNonNull(observedState);
        switch (outcome) {
            case CONVERGED -> {}
            case HARD_FAILED -> throw requireNonNull(failure);
            case TIMED_OUT -> throw new ConvergenceTimeoutException(
                    description, requireNonNull(bound), attempts, observedState.get());
        }
    }
}
