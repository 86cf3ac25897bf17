// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.convergence;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when a poll exhausted one of its bounds before the awaited condition held. The caller may retry, the
 * poller never does.
 */
public class ConvergenceTimeoutException extends ConvergenceException {

    private final ExhaustedBound bound;
    private final long attempts;
    private final String observedState;

    /**
     * Creates a new exception.
     *
     * @param description   what was awaited
     * @param bound         the bound that was exhausted
     * @param attempts      the number of predicate evaluations made
     * @param observedState the last observed state of all polled nodes
     */
    public ConvergenceTimeoutException(
            @NonNull final String description,
            @NonNull final ExhaustedBound bound,
            final long attempts,
            @NonNull final String observedState) {
        super("%s: %s bound exhausted after %d attempt(s), observed %s"
                .formatted(requireNonNull(description), requireNonNull(bound), attempts, requireNonNull(observedState)));
        this.bound = bound;
        this.attempts = attempts;
        this.observedState = observedState;
    }

    @NonNull
    public ExhaustedBound bound() {
        return bound;
    }

    public long attempts() {
        return attempts;
    }

    @NonNull
    public String observedState() {
        return observedState;
    }
}
