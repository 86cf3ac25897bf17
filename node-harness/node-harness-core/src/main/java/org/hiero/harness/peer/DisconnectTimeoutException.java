// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.peer;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import org.hiero.harness.rpc.PeerInfo;

/**
 * Thrown when a node still lists a peer after all attempts to observe its disconnection were used up.
 */
public class DisconnectTimeoutException extends RuntimeException {

    private final int peerIndex;
    private final List<PeerInfo> remainingPeers;

    /**
     * Creates a new exception.
     *
     * @param nodeName       the name of the node that was asked to disconnect
     * @param peerIndex      the index of the node that should have been disconnected
     * @param attempts       the number of peer list queries made
     * @param remainingPeers the peer entries still belonging to that node at the last query
     */
    public DisconnectTimeoutException(
            @NonNull final String nodeName,
            final int peerIndex,
            final long attempts,
            @NonNull final List<PeerInfo> remainingPeers) {
        super("Timed out waiting for %s to disconnect from testnode%d after %d attempt(s), still connected: %s"
                .formatted(requireNonNull(nodeName), peerIndex, attempts, remainingPeers));
        this.peerIndex = peerIndex;
        this.remainingPeers = List.copyOf(remainingPeers);
    }

    public int peerIndex() {
        return peerIndex;
    }

    @NonNull
    public List<PeerInfo> remainingPeers() {
        return remainingPeers;
    }
}
