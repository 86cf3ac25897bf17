// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.convergence;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;
import org.hiero.harness.config.HarnessConfig;

/**
 * The budgets of a node sync check.
 *
 * @param roundWait the budget of one round: how long a node may block waiting for a height, or the pause between
 *                  two rounds of the hash and mempool checks
 * @param timeout   the overall timeout of the check
 */
public record SyncOptions(@NonNull Duration roundWait, @NonNull Duration timeout) {

    /** Nodes treat a zero height wait as "wait forever", so a round never waits less than this. */
    public static final Duration MIN_ROUND_WAIT = Duration.ofMillis(1);

    public SyncOptions {
        requireNonNull(roundWait, "roundWait must not be null");
        requireNonNull(timeout, "timeout must not be null");
        if (roundWait.compareTo(MIN_ROUND_WAIT) < 0) {
            throw new IllegalArgumentException("roundWait must be at least " + MIN_ROUND_WAIT);
        }
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    @NonNull
    public static SyncOptions from(@NonNull final HarnessConfig config) {
        return new SyncOptions(config.syncWait(), config.syncTimeout());
    }
}
