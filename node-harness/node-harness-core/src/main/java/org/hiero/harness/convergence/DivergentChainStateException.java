// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.convergence;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import org.hiero.harness.rpc.ChainTip;

/**
 * Thrown when all nodes reached the same height but disagree on the block at that height. This indicates a fork
 * and is never retried.
 */
public class DivergentChainStateException extends ConvergenceException {

    private final List<ChainTip> tips;

    /**
     * Creates a new exception.
     *
     * @param message the detail message
     * @param tips    the tips reported by the nodes, in node order
     */
    public DivergentChainStateException(@NonNull final String message, @NonNull final List<ChainTip> tips) {
        super(requireNonNull(message));
        this.tips = List.copyOf(tips);
    }

    @NonNull
    public List<ChainTip> tips() {
        return tips;
    }
}
