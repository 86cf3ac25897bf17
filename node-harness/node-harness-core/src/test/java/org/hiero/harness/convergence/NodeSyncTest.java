// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.convergence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import org.hiero.harness.rpc.ChainTip;
import org.hiero.harness.rpc.FakeNode;
import org.hiero.harness.rpc.RpcException;
import org.hiero.harness.time.FakeTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link NodeSync}.
 */
class NodeSyncTest {

    private static final SyncOptions OPTIONS = new SyncOptions(Duration.ofSeconds(1), Duration.ofSeconds(60));

    private FakeTime time;
    private NodeSync nodeSync;

    @BeforeEach
    void setUp() {
        time = new FakeTime();
        nodeSync = new NodeSync(new ConvergencePoller(time, Duration.ofMillis(50), Duration.ofSeconds(60)), OPTIONS);
    }

    private FakeNode node(final int index) {
        return new FakeNode(index, time);
    }

    @Test
    void syncBlocksSucceedsImmediatelyWhenAllNodesAgree() {
        final List<FakeNode> nodes = List.of(node(0).tip(5, "h5"), node(1).tip(5, "h5"), node(2).tip(5, "h5"));

        nodeSync.syncBlocks(nodes);

        assertThat(nodes).allSatisfy(node -> assertThat(node.calls("waitforblockheight")).isEqualTo(1));
        assertThat(time.elapsed()).isZero();
    }

    @Test
    void syncBlocksWaitsForLaggingNodesToReachTheHighestHeight() {
        final FakeNode lagging1 = node(0).tip(5, "h5").catchUpAfterWaits(2, 6, "h6");
        final FakeNode lagging2 = node(1).tip(5, "h5").catchUpAfterWaits(1, 6, "h6");
        final FakeNode leader = node(2).tip(6, "h6");

        nodeSync.syncBlocks(List.of(lagging1, lagging2, leader));

        assertThat(leader.calls("waitforblockheight")).isEqualTo(3);
        assertThat(time.elapsed()).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    void syncBlocksQueriesTargetHeightOnlyOnce() {
        final FakeNode ahead = node(0).tip(6, "h6");
        final FakeNode behind = node(1).tip(5, "h5").blockCount(6).catchUpAfterWaits(1, 6, "h6");

        nodeSync.syncBlocks(List.of(ahead, behind));

        assertThat(behind.calls("getblockcount")).isEqualTo(1);
        assertThat(behind.calls("waitforblockheight")).isEqualTo(2);
    }

    @Test
    void syncBlocksFailsImmediatelyOnMismatchedHashes() {
        final List<FakeNode> nodes = List.of(node(0).tip(5, "a"), node(1).tip(5, "b"));

        assertThatThrownBy(() -> nodeSync.syncBlocks(nodes))
                .isInstanceOfSatisfying(DivergentChainStateException.class, e -> assertThat(e.tips())
                        .containsExactly(new ChainTip(5, "a"), new ChainTip(5, "b")))
                .hasMessageContaining("node0={height=5, hash=a}")
                .hasMessageContaining("node1={height=5, hash=b}");
        assertThat(nodes).allSatisfy(node -> assertThat(node.calls("waitforblockheight")).isEqualTo(1));
    }

    @Test
    void syncBlocksTimesOutListingEveryTip() {
        final List<FakeNode> nodes = List.of(node(0).tip(4, "h4"), node(1).tip(7, "h7"));

        assertThatThrownBy(() -> nodeSync.syncBlocks(nodes))
                .isInstanceOfSatisfying(
                        ConvergenceTimeoutException.class,
                        e -> assertThat(e.bound()).isEqualTo(ExhaustedBound.TIMEOUT))
                .hasMessageContaining("height 7")
                .hasMessageContaining("node0={height=4, hash=h4}")
                .hasMessageContaining("node1={height=7, hash=h7}");
        assertThat(time.elapsed()).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void syncBlocksPropagatesRpcErrorsWithoutRetry() {
        final RpcException failure = new RpcException("waitforblockheight", -28, "Loading block index");
        final FakeNode broken = node(1).tip(5, "h5").failOn("waitforblockheight", failure);

        assertThatThrownBy(() -> nodeSync.syncBlocks(List.of(node(0).tip(5, "h5"), broken)))
                .isSameAs(failure);
        assertThat(broken.calls("waitforblockheight")).isEqualTo(1);
    }

    @Test
    void syncChainSucceedsOnlyOnceBestHashesMatch() {
        final FakeNode behind = node(1).tip(5, "h5");
        final FakeNode ahead = node(0).tip(6, "h6");

        final SyncOptions shortTimeout = new SyncOptions(Duration.ofSeconds(1), Duration.ofSeconds(3));
        assertThatThrownBy(() -> nodeSync.syncChain(List.of(ahead, behind), shortTimeout))
                .isInstanceOf(ConvergenceTimeoutException.class)
                .hasMessageContaining("node0=h6")
                .hasMessageContaining("node1=h5");

        behind.tip(6, "h6");
        assertThatCode(() -> nodeSync.syncChain(List.of(ahead, behind))).doesNotThrowAnyException();
    }

    @Test
    void syncMempoolsWaitsForTheSmallerPoolToCatchUp() {
        final FakeNode full = node(0).mempool("a", "b", "c");
        final FakeNode partial = node(1).mempool("a", "b").receiveTransactionAfterQueries(2, "c");

        nodeSync.syncMempools(List.of(full, partial));

        assertThat(partial.calls("getrawmempool")).isEqualTo(3);
        assertThat(time.elapsed()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void syncMempoolsTimesOutWhenPoolsNeverMatch() {
        final List<FakeNode> nodes = List.of(node(0).mempool("a", "b"), node(1).mempool("a", "b", "c"));

        assertThatThrownBy(() -> nodeSync.syncMempools(nodes))
                .isInstanceOf(ConvergenceTimeoutException.class)
                .hasMessageContaining("node0=[a, b]")
                .hasMessageContaining("node1=[a, b, c]");
        assertThat(nodes.get(0).calls("getrawmempool")).isEqualTo(60);
    }

    @Test
    void roundWaitBelowOneMillisecondIsRejected() {
        assertThatThrownBy(() -> new SyncOptions(Duration.ZERO, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("roundWait");
        assertThatThrownBy(() -> new SyncOptions(Duration.ofNanos(500_000), Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatCode(() -> new SyncOptions(SyncOptions.MIN_ROUND_WAIT, Duration.ofSeconds(1)))
                .doesNotThrowAnyException();
    }
}
