// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.port;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.hiero.harness.config.HarnessConfig;

/**
 * Derives the p2p and RPC ports of every node of a test process from the process' {@link PortSeed}.
 *
 * <p>Each port class owns a range of {@link #PORT_RANGE} ports starting at {@link #PORT_MIN} (p2p) or
 * {@code PORT_MIN + PORT_RANGE} (RPC). Inside that range a seed selects a window of {@link #MAX_NODES} consecutive
 * ports at offset {@code (MAX_NODES * seed) mod (PORT_RANGE - 1 - MAX_NODES)}. Distinct seeds below
 * {@link #SEED_MODULUS} map to distinct offsets, but windows of nearby offsets can still overlap, so this scheme only
 * makes collisions between parallel test processes unlikely. It does not rule them out.
 *
 * <p>Ports are pure functions of the seed and the node index.
 */
public final class PortAllocator {

    /** The maximum number of nodes a single test can spawn. */
    public static final int MAX_NODES = 8;

    /** No p2p or RPC port is assigned below this value. */
    public static final int PORT_MIN = 11000;

    /** The number of ports reserved for each port class. */
    public static final int PORT_RANGE = 5000;

    /** Seeds are reduced modulo this value when computing the window offset. */
    public static final int SEED_MODULUS = PORT_RANGE - 1 - MAX_NODES;

    private final PortSeed seed;
    private final int offset;

    /**
     * Creates an allocator for the given seed.
     *
     * @param seed the seed of this test process
     */
    public PortAllocator(@NonNull final PortSeed seed) {
        this.seed = requireNonNull(seed);
        this.offset = (int) (((long) MAX_NODES * seed.value()) % SEED_MODULUS);
    }

    /**
     * Creates an allocator for the configured seed, or for the seed of the current process if none is configured.
     *
     * @param config the harness configuration
     * @return the allocator
     */
    @NonNull
    public static PortAllocator create(@NonNull final HarnessConfig config) {
        return new PortAllocator(config.portSeedOrDefault());
    }

    /**
     * Returns the seed this allocator was created with.
     *
     * @return the port seed
     */
    @NonNull
    public PortSeed seed() {
        return seed;
    }

    /**
     * Returns the p2p port of a node.
     *
     * @param nodeIndex the index of the node, in {@code [0, MAX_NODES)}
     * @return the p2p port
     * @throws IllegalArgumentException if the index is out of range
     */
    public int p2pPort(final int nodeIndex) {
        return portFor(PortType.P2P, nodeIndex);
    }

    /**
     * Returns the RPC port of a node.
     *
     * @param nodeIndex the index of the node, in {@code [0, MAX_NODES)}
     * @return the RPC port
     * @throws IllegalArgumentException if the index is out of range
     */
    public int rpcPort(final int nodeIndex) {
        return portFor(PortType.RPC, nodeIndex);
    }

    /**
     * Returns the port of the given class for a node.
     *
     * @param portType  the port class
     * @param nodeIndex the index of the node, in {@code [0, MAX_NODES)}
     * @return the port
     * @throws IllegalArgumentException if the index is out of range
     */
    public int portFor(@NonNull final PortType portType, final int nodeIndex) {
        requireNonNull(portType);
        checkNodeIndex(nodeIndex);
        return rangeStart(portType) + nodeIndex + offset;
    }

    /**
     * Returns the window of ports of the given class that this seed may hand out.
     *
     * @param portType the port class
     * @return the window covering node indexes {@code 0} to {@code MAX_NODES - 1}
     */
    @NonNull
    public PortWindow window(@NonNull final PortType portType) {
        requireNonNull(portType);
        final int first = rangeStart(portType) + offset;
        return new PortWindow(first, first + MAX_NODES - 1);
    }

    /**
     * Returns the {@code host:port} address under which a node accepts peer connections.
     *
     * @param host      the host name or IP address
     * @param nodeIndex the index of the node
     * @return the p2p address
     */
    @NonNull
    public String p2pAddress(@NonNull final String host, final int nodeIndex) {
        requireNonNull(host);
        return host + ":" + p2pPort(nodeIndex);
    }

    private static int rangeStart(@NonNull final PortType portType) {
        return switch (portType) {
            case P2P -> PORT_MIN;
            case RPC -> PORT_MIN + PORT_RANGE;
        };
    }

    private static void checkNodeIndex(final int nodeIndex) {
        if (nodeIndex < 0 || nodeIndex >= MAX_NODES) {
            throw new IllegalArgumentException(
                    "Node index %d is outside [0, %d)".formatted(nodeIndex, MAX_NODES));
        }
    }

    @Override
    public String toString() {
        return "PortAllocator[seed=" + seed.value() + ", p2p=" + window(PortType.P2P) + ", rpc="
                + window(PortType.RPC) + "]";
    }
}
