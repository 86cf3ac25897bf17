// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.convergence;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Base class of the failures raised when nodes did not converge.
 */
public abstract class ConvergenceException extends RuntimeException {

    protected ConvergenceException(@NonNull final String message) {
        super(message);
    }
}
