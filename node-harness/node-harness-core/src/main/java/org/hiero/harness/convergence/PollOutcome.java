// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.convergence;

/**
 * How a poll ended.
 */
public enum PollOutcome {
    /** The predicate was satisfied. */
    CONVERGED,
    /** A bound was exhausted before the predicate was satisfied. */
    TIMED_OUT,
    /** The predicate failed with an exception, which ended the poll without further attempts. */
    HARD_FAILED
}
