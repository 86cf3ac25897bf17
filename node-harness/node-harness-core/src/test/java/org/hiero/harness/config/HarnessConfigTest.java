// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.hiero.harness.port.PortSeed;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link HarnessConfig}.
 */
class HarnessConfigTest {

    @Test
    void defaultsMatchTheBundledProperties() {
        final HarnessConfig config = HarnessConfig.from(HarnessPropertySource.defaults());

        assertThat(config.pollInterval()).isEqualTo(Duration.ofMillis(50));
        assertThat(config.defaultTimeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.syncWait()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.syncTimeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.peerPollInterval()).isEqualTo(Duration.ofMillis(100));
        assertThat(config.peerDisconnectAttempts()).isEqualTo(50);
        assertThat(config.peerHost()).isEqualTo("127.0.0.1");
        assertThat(config.rpcHost()).isEqualTo("127.0.0.1");
        assertThat(config.rpcRequestTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.portSeed()).isNull();
    }

    @Test
    void overridesReplaceDefaults() {
        final HarnessConfig config = HarnessConfig.from(HarnessPropertySource.inPriorityOrder(
                new MapPropertySource(Map.of(HarnessConfig.SYNC_TIMEOUT, "5m", HarnessConfig.PORT_SEED, "12")),
                HarnessPropertySource.defaults()));

        assertThat(config.syncTimeout()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.portSeedOrDefault()).isEqualTo(PortSeed.of(12));
    }

    @Test
    void missingSeedFallsBackToProcessSeed() {
        final HarnessConfig config = HarnessConfig.from(HarnessPropertySource.defaults());

        assertThat(config.portSeedOrDefault()).isEqualTo(PortSeed.fromCurrentProcess());
    }

    @Test
    void nonPositiveTimeoutIsRejected() {
        final Map<String, String> props = new HashMap<>();
        props.put(HarnessConfig.POLL_DEFAULT_TIMEOUT, "0s");

        assertThatThrownBy(() -> HarnessConfig.from(HarnessPropertySource.inPriorityOrder(
                        new MapPropertySource(props), HarnessPropertySource.defaults())))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nonPositiveDisconnectAttemptsAreRejected() {
        assertThatThrownBy(() -> HarnessConfig.from(HarnessPropertySource.inPriorityOrder(
                        new MapPropertySource(Map.of(HarnessConfig.PEER_DISCONNECT_ATTEMPTS, "0")),
                        HarnessPropertySource.defaults())))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
