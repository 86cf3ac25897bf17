// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.rpc;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Instant;
import java.util.List;

/**
 * Utility operations over several nodes.
 */
public final class NodeRpcs {

    private NodeRpcs() {}

    /**
     * Sets the mock time of every node.
     *
     * @param nodes the nodes
     * @param time  the time the nodes should report
     */
    public static void setNodeTimes(@NonNull final List<? extends NodeRpc> nodes, @NonNull final Instant time) {
        requireNonNull(nodes);
        requireNonNull(time);
        for (final NodeRpc node : nodes) {
            node.setMockTime(time.getEpochSecond());
        }
    }
}
