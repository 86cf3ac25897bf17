// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.convergence;

/**
 * The bound of a poll that ran out before its predicate was satisfied.
 */
public enum ExhaustedBound {
    /** The maximum number of predicate evaluations was reached. */
    ATTEMPTS,
    /** The wall-clock timeout elapsed. */
    TIMEOUT
}
