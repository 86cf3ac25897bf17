// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.peer;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when only one direction of a bidirectional link could be established. The established direction has been
 * rolled back when this is thrown, unless a suppressed exception reports that the rollback failed as well.
 */
public class PeerLinkException extends RuntimeException {

    private final int fromIndex;
    private final int toIndex;

    /**
     * Creates a new exception.
     *
     * @param fromIndex the index of the node that failed to connect
     * @param toIndex   the index of the node it should have connected to
     * @param cause     the failure of the connect attempt
     */
    public PeerLinkException(final int fromIndex, final int toIndex, @NonNull final Throwable cause) {
        super("Failed to link node%d to node%d".formatted(fromIndex, toIndex), cause);
        this.fromIndex = fromIndex;
        this.toIndex = toIndex;
    }

    public int fromIndex() {
        return fromIndex;
    }

    public int toIndex() {
        return toIndex;
    }
}
