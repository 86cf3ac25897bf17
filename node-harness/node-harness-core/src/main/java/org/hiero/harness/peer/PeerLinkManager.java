// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.peer;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.harness.config.HarnessConfig;
import org.hiero.harness.convergence.ConvergencePoller;
import org.hiero.harness.convergence.PollBounds;
import org.hiero.harness.convergence.PollResult;
import org.hiero.harness.port.PortAllocator;
import org.hiero.harness.rpc.AddNodeCommand;
import org.hiero.harness.rpc.NodeRpc;
import org.hiero.harness.rpc.PeerInfo;

/**
 * Connects and disconnects nodes of a test network and waits until the nodes observed the change.
 */
public class PeerLinkManager {

    private static final Logger log = LogManager.getLogger(PeerLinkManager.class);

    private final PortAllocator ports;
    private final ConvergencePoller poller;
    private final String host;
    private final int disconnectAttempts;

    /**
     * Creates a new manager.
     *
     * @param ports              the allocator that assigned the nodes' p2p ports
     * @param poller             the poller used to wait for peer list changes
     * @param host               the host under which the nodes reach each other
     * @param disconnectAttempts the number of peer list queries before a disconnect is declared failed
     */
    public PeerLinkManager(
            @NonNull final PortAllocator ports,
            @NonNull final ConvergencePoller poller,
            @NonNull final String host,
            final int disconnectAttempts) {
        this.ports = requireNonNull(ports);
        this.poller = requireNonNull(poller);
        this.host = requireNonNull(host);
        if (disconnectAttempts <= 0) {
            throw new IllegalArgumentException("disconnectAttempts must be positive");
        }
        this.disconnectAttempts = disconnectAttempts;
    }

    /**
     * Creates a manager on the OS clock with the configured peer settings.
     *
     * @param ports  the allocator that assigned the nodes' p2p ports
     * @param config the harness configuration
     * @return the manager
     */
    @NonNull
    public static PeerLinkManager create(@NonNull final PortAllocator ports, @NonNull final HarnessConfig config) {
        return new PeerLinkManager(
                ports,
                ConvergencePoller.create(config).withInterval(config.peerPollInterval()),
                config.peerHost(),
                config.peerDisconnectAttempts());
    }

    /**
     * Makes {@code from} connect to the node with the given index and waits until the version handshake completed
     * with all of its peers.
     *
     * @param from    the node initiating the connection
     * @param toIndex the index of the node to connect to
     * @throws org.hiero.harness.convergence.ConvergenceTimeoutException if a handshake is still pending when the
     *                                                                    default timeout elapsed
     */
    public void connect(@NonNull final NodeRpc from, final int toIndex) {
        requireNonNull(from);
        final String address = ports.p2pAddress(host, toIndex);
        from.addNode(address, AddNodeCommand.ONETRY);
        final List<PeerInfo> observed = new ArrayList<>();
        poller.poll(
                        () -> {
                            final List<PeerInfo> peers = from.getPeerInfo();
                            observed.clear();
                            observed.addAll(peers);
                            return peers.stream().allMatch(PeerInfo::handshakeComplete);
                        },
                        PollBounds.unbounded())
                .orThrow("Handshake of %s with %s".formatted(from.name(), address), observed::toString);
        log.info("Connected {} to node{} at {}", from.name(), toIndex, address);
    }

    /**
     * Makes {@code from} drop every connection to the node with the given index and waits until its peer list no
     * longer contains that node.
     *
     * @param from    the node dropping the connections
     * @param toIndex the index of the node to disconnect from
     * @throws DisconnectTimeoutException if the peer is still listed after all attempts
     */
    public void disconnect(@NonNull final NodeRpc from, final int toIndex) {
        requireNonNull(from);
        for (final PeerInfo peer : peersOf(from, toIndex)) {
            from.disconnectNode(peer.id());
        }
        final List<PeerInfo> remaining = new ArrayList<>();
        final PollResult result = poller.poll(
                () -> {
                    final List<PeerInfo> peers = peersOf(from, toIndex);
                    remaining.clear();
                    remaining.addAll(peers);
                    return peers.isEmpty();
                },
                PollBounds.attempts(disconnectAttempts));
        switch (result.outcome()) {
            case CONVERGED -> log.info("Disconnected {} from node{}", from.name(), toIndex);
            case HARD_FAILED -> result.orThrow("Disconnect of %s from node%d".formatted(from.name(), toIndex));
            case TIMED_OUT -> throw new DisconnectTimeoutException(from.name(), toIndex, result.attempts(), remaining);
        }
    }

    /**
     * Connects two nodes in both directions. If the second direction fails, the first one is disconnected again
     * before the failure is reported.
     *
     * @param first  one node
     * @param second the other node
     * @throws PeerLinkException if one of the directions could not be established
     */
    public void connectBidirectional(@NonNull final NodeRpc first, @NonNull final NodeRpc second) {
        requireNonNull(first);
        requireNonNull(second);
        try {
            connect(first, second.index());
        } catch (final RuntimeException e) {
            throw new PeerLinkException(first.index(), second.index(), e);
        }
        try {
            connect(second, first.index());
        } catch (final RuntimeException e) {
            final PeerLinkException failure = new PeerLinkException(second.index(), first.index(), e);
            log.warn("Rolling back link from {} to {}", first.name(), second.name(), e);
            try {
                disconnect(first, second.index());
            } catch (final RuntimeException rollbackFailure) {
                failure.addSuppressed(rollbackFailure);
            }
            throw failure;
        }
    }

    /**
     * Disconnects two nodes in both directions.
     *
     * @param first  one node
     * @param second the other node
     * @throws DisconnectTimeoutException if one of the nodes still lists the other after all attempts
     */
    public void disconnectBidirectional(@NonNull final NodeRpc first, @NonNull final NodeRpc second) {
        requireNonNull(first);
        requireNonNull(second);
        disconnect(first, second.index());
        disconnect(second, first.index());
    }

    @NonNull
    private static List<PeerInfo> peersOf(@NonNull final NodeRpc node, final int peerIndex) {
        return node.getPeerInfo().stream().filter(peer -> peer.belongsTo(peerIndex)).toList();
    }
}
