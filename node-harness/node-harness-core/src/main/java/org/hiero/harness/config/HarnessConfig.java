// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.config;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.time.Duration;
import org.hiero.harness.port.PortSeed;

/**
 * Typed view of the harness properties.
 *
 * @param pollInterval           the pause between two evaluations of a convergence predicate
 * @param defaultTimeout         the ceiling applied to waits that were requested without any bound
 * @param syncWait               the per-round wait budget of the node sync checks
 * @param syncTimeout            the overall timeout of the node sync checks
 * @param peerPollInterval       the pause between two peer list queries while linking nodes
 * @param peerDisconnectAttempts the number of peer list queries before a disconnect is declared failed
 * @param peerHost               the host under which nodes reach each other's p2p port
 * @param rpcHost                the host on which nodes serve JSON-RPC
 * @param rpcRequestTimeout      the timeout of a single JSON-RPC request
 * @param portSeed               the explicit port seed, or {@code null} to derive it from the process id
 */
public record HarnessConfig(
        @NonNull Duration pollInterval,
        @NonNull Duration defaultTimeout,
        @NonNull Duration syncWait,
        @NonNull Duration syncTimeout,
        @NonNull Duration peerPollInterval,
        int peerDisconnectAttempts,
        @NonNull String peerHost,
        @NonNull String rpcHost,
        @NonNull Duration rpcRequestTimeout,
        @Nullable PortSeed portSeed) {

    public static final String POLL_INTERVAL = "harness.poll.interval";
    public static final String POLL_DEFAULT_TIMEOUT = "harness.poll.defaultTimeout";
    public static final String SYNC_WAIT = "harness.sync.wait";
    public static final String SYNC_TIMEOUT = "harness.sync.timeout";
    public static final String PEER_POLL_INTERVAL = "harness.peer.pollInterval";
    public static final String PEER_DISCONNECT_ATTEMPTS = "harness.peer.disconnectAttempts";
    public static final String PEER_HOST = "harness.peer.host";
    public static final String RPC_HOST = "harness.rpc.host";
    public static final String RPC_REQUEST_TIMEOUT = "harness.rpc.requestTimeout";
    public static final String PORT_SEED = "harness.portSeed";

    public HarnessConfig {
        requireNonNull(pollInterval, "pollInterval must not be null");
        requireNonNull(defaultTimeout, "defaultTimeout must not be null");
        requireNonNull(syncWait, "syncWait must not be null");
        requireNonNull(syncTimeout, "syncTimeout must not be null");
        requireNonNull(peerPollInterval, "peerPollInterval must not be null");
        requireNonNull(peerHost, "peerHost must not be null");
        requireNonNull(rpcHost, "rpcHost must not be null");
        requireNonNull(rpcRequestTimeout, "rpcRequestTimeout must not be null");
        if (pollInterval.isNegative() || peerPollInterval.isNegative()) {
            throw new IllegalArgumentException("Poll intervals must not be negative");
        }
        if (isNotPositive(defaultTimeout) || isNotPositive(syncTimeout) || isNotPositive(rpcRequestTimeout)) {
            throw new IllegalArgumentException("Timeouts must be positive");
        }
        if (peerDisconnectAttempts <= 0) {
            throw new IllegalArgumentException("peerDisconnectAttempts must be positive");
        }
    }

    /**
     * Loads the configuration from the bundled defaults, overridden by {@code harness.*} system properties.
     *
     * @return the configuration
     */
    @NonNull
    public static HarnessConfig load() {
        return from(HarnessPropertySource.inPriorityOrder(
                HarnessPropertySource.fromSystemProperties(), HarnessPropertySource.defaults()));
    }

    /**
     * Reads the configuration from the given property source.
     *
     * @param source the property source
     * @return the configuration
     */
    @NonNull
    public static HarnessConfig from(@NonNull final HarnessPropertySource source) {
        requireNonNull(source);
        return new HarnessConfig(
                source.getDuration(POLL_INTERVAL),
                source.getDuration(POLL_DEFAULT_TIMEOUT),
                source.getDuration(SYNC_WAIT),
                source.getDuration(SYNC_TIMEOUT),
                source.getDuration(PEER_POLL_INTERVAL),
                source.getInteger(PEER_DISCONNECT_ATTEMPTS),
                source.getString(PEER_HOST),
                source.getString(RPC_HOST),
                source.getDuration(RPC_REQUEST_TIMEOUT),
                source.has(PORT_SEED) ? PortSeed.of(source.getInteger(PORT_SEED)) : null);
    }

    /**
     * Returns the configured port seed, or the one derived from the current process.
     *
     * @return the port seed to use
     */
    @NonNull
    public PortSeed portSeedOrDefault() {
        return portSeed != null ? portSeed : PortSeed.fromCurrentProcess();
    }

    private static boolean isNotPositive(@NonNull final Duration duration) {
        return duration.isZero() || duration.isNegative();
    }
}
