// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.convergence;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.harness.config.HarnessConfig;
import org.hiero.harness.rpc.ChainTip;
import org.hiero.harness.rpc.NodeRpc;

/**
 * Checks that a set of nodes agree on their chain or their memory pool.
 *
 * <p>Each round queries the nodes in list order and decides only after all of them answered. RPC failures are not
 * retried.
 */
public class NodeSync {

    private static final Logger log = LogManager.getLogger(NodeSync.class);

    private final ConvergencePoller poller;
    private final SyncOptions defaults;

    /**
     * Creates a new instance.
     *
     * @param poller   the poller whose time source and default timeout are used
     * @param defaults the budgets used when a check is called without options
     */
    public NodeSync(@NonNull final ConvergencePoller poller, @NonNull final SyncOptions defaults) {
        this.poller = requireNonNull(poller);
        this.defaults = requireNonNull(defaults);
    }

    /**
     * Creates an instance on the OS clock with the configured budgets.
     *
     * @param config the harness configuration
     * @return the instance
     */
    @NonNull
    public static NodeSync create(@NonNull final HarnessConfig config) {
        return new NodeSync(ConvergencePoller.create(config), SyncOptions.from(config));
    }

    public void syncBlocks(@NonNull final List<? extends NodeRpc> nodes) {
        syncBlocks(nodes, defaults);
    }

    /**
     * Waits until all nodes are at the same height with the same block at that height.
     *
     * <p>The target height is the highest block count any node reports at the start. Each round every node is asked
     * to wait for that height for up to {@link SyncOptions#roundWait()}.
     *
     * @param nodes   the nodes to check
     * @param options the budgets of the check
     * @throws DivergentChainStateException if all nodes reached the target height but report different blocks
     * @throws ConvergenceTimeoutException  if the nodes did not reach the target height in time
     */
    public void syncBlocks(@NonNull final List<? extends NodeRpc> nodes, @NonNull final SyncOptions options) {
        requireNonNull(nodes);
        requireNonNull(options);
        final long maxHeight =
                nodes.stream().mapToLong(NodeRpc::getBlockCount).max().orElse(0L);
        final List<ChainTip> tips = new ArrayList<>();
        final PollResult result = poller.withInterval(Duration.ZERO)
                .poll(
                        () -> {
                            final List<ChainTip> round = new ArrayList<>(nodes.size());
                            for (final NodeRpc node : nodes) {
                                round.add(node.waitForBlockHeight(maxHeight, options.roundWait()));
                            }
                            tips.clear();
                            tips.addAll(round);
                            log.debug("Tips while syncing to height {}: {}", maxHeight, round);
                            return reachedAgreedTip(nodes, round, maxHeight);
                        },
                        PollBounds.timeout(options.timeout()));
        result.orThrow(
                "Block sync to height %d timed out".formatted(maxHeight), () -> describe(nodes, tips));
        log.info("{} node(s) synced to height {}", nodes.size(), maxHeight);
    }

    public void syncChain(@NonNull final List<? extends NodeRpc> nodes) {
        syncChain(nodes, defaults);
    }

    /**
     * Waits until all nodes report the same best block hash.
     *
     * @param nodes   the nodes to check
     * @param options the budgets of the check
     * @throws ConvergenceTimeoutException if the hashes still differ when the timeout elapsed
     */
    public void syncChain(@NonNull final List<? extends NodeRpc> nodes, @NonNull final SyncOptions options) {
        awaitEqual(nodes, options, NodeRpc::getBestBlockHash, "Chain sync failed: best block hashes don't match");
        log.info("{} node(s) agree on the best block", nodes.size());
    }

    public void syncMempools(@NonNull final List<? extends NodeRpc> nodes) {
        syncMempools(nodes, defaults);
    }

    /**
     * Waits until all nodes hold the same set of transactions in their memory pool.
     *
     * @param nodes   the nodes to check
     * @param options the budgets of the check
     * @throws ConvergenceTimeoutException if the memory pools still differ when the timeout elapsed
     */
    public void syncMempools(@NonNull final List<? extends NodeRpc> nodes, @NonNull final SyncOptions options) {
        awaitEqual(nodes, options, NodeRpc::getRawMempool, "Mempool sync failed: memory pools don't match");
        log.info("{} node(s) agree on their memory pool", nodes.size());
    }

    private <T> void awaitEqual(
            @NonNull final List<? extends NodeRpc> nodes,
            @NonNull final SyncOptions options,
            @NonNull final Function<NodeRpc, T> query,
            @NonNull final String description) {
        requireNonNull(nodes);
        requireNonNull(options);
        final List<T> values = new ArrayList<>();
        final PollResult result = poller.withInterval(options.roundWait())
                .poll(
                        () -> {
                            final List<T> round = new ArrayList<>(nodes.size());
                            for (final NodeRpc node : nodes) {
                                round.add(query.apply(node));
                            }
                            values.clear();
                            values.addAll(round);
                            log.debug("{}: observed {}", description, round);
                            return round.stream().distinct().count() <= 1;
                        },
                        PollBounds.timeout(options.timeout()));
        result.orThrow(description, () -> describe(nodes, values));
    }

    private static boolean reachedAgreedTip(
            @NonNull final List<? extends NodeRpc> nodes, @NonNull final List<ChainTip> tips, final long maxHeight) {
        if (!tips.stream().allMatch(tip -> tip.height() == maxHeight)) {
            return false;
        }
        if (tips.stream().map(ChainTip::hash).distinct().count() > 1) {
            throw new DivergentChainStateException(
                    "Block sync failed, mismatched block hashes: " + describe(nodes, tips), tips);
        }
        return true;
    }

    @NonNull
    private static String describe(@NonNull final List<? extends NodeRpc> nodes, @NonNull final List<?> values) {
        final List<String> entries = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            entries.add(nodes.get(i).name() + "=" + values.get(i));
        }
        return entries.stream().collect(Collectors.joining(", ", "[", "]"));
    }
}
