// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.rpc;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;

/**
 * The RPC interface of one node.
 *
 * <p>Implementations only have to provide {@link #call(String, Object...)}; the typed operations translate to the
 * node's JSON-RPC methods. Every operation blocks until the node answered. A structured error answer is thrown as
 * {@link RpcException}, a failure to reach the node as {@link RpcTransportException}.
 *
 * <p>Instances are owned by whoever started the node. The harness only borrows them for the duration of an
 * operation.
 */
public interface NodeRpc {

    /**
     * Returns the index of this node within its test network.
     *
     * @return the node index
     */
    int index();

    /**
     * Returns a human-readable name of this node for diagnostics.
     *
     * @return the node name
     */
    @NonNull
    default String name() {
        return "node" + index();
    }

    /**
     * Invokes an RPC method.
     *
     * @param method the method name
     * @param params the positional parameters
     * @return the {@code result} member of the response, a {@code NullNode} if it was {@code null}
     * @throws RpcException          if the node answered with an error
     * @throws RpcTransportException if the node could not be reached
     */
    @NonNull
    JsonNode call(@NonNull String method, @NonNull Object... params);

    default long getBlockCount() {
        return call("getblockcount").asLong();
    }

    @NonNull
    default String getBestBlockHash() {
        return call("getbestblockhash").asText();
    }

    /**
     * Blocks until the node reached the given height or the wait elapsed, whichever comes first.
     *
     * <p>The wait is sent in whole milliseconds, rounded up, and never as zero: a node reads a zero timeout as
     * "wait indefinitely".
     *
     * @param height the height to wait for
     * @param wait   the maximum time the node may block
     * @return the node's tip when the call returned, which may be below the requested height
     * @throws IllegalArgumentException if the wait is negative
     */
    @NonNull
    default ChainTip waitForBlockHeight(final long height, @NonNull final Duration wait) {
        requireNonNull(wait);
        if (wait.isNegative()) {
            throw new IllegalArgumentException("wait must not be negative");
        }
        final long millis = Math.max(1L, wait.plusNanos(999_999).toMillis());
        return ChainTip.fromJson(call("waitforblockheight", height, millis));
    }

    @NonNull
    default List<PeerInfo> getPeerInfo() {
        final JsonNode peers = call("getpeerinfo");
        final List<PeerInfo> result = new ArrayList<>(peers.size());
        peers.forEach(peer -> result.add(PeerInfo.fromJson(peer)));
        return ImmutableList.copyOf(result);
    }

    /**
     * Returns the ids of the transactions in the node's memory pool.
     *
     * @return the transaction ids in lexicographic order
     */
    @NonNull
    default SortedSet<String> getRawMempool() {
        final ImmutableSortedSet.Builder<String> txIds = ImmutableSortedSet.naturalOrder();
        call("getrawmempool").forEach(txId -> txIds.add(txId.asText()));
        return txIds.build();
    }

    default void addNode(@NonNull final String address, @NonNull final AddNodeCommand command) {
        requireNonNull(address);
        requireNonNull(command);
        call("addnode", address, command.wireName());
    }

    default void disconnectNode(final long peerId) {
        call("disconnectnode", "", peerId);
    }

    @NonNull
    default String getNewAddress() {
        return call("getnewaddress").asText();
    }

    default void setMockTime(final long epochSeconds) {
        call("setmocktime", epochSeconds);
    }

    /**
     * Publishes a contract.
     *
     * @param artifact the path of the contract source on the node's file system
     * @return the node's answer, carrying {@code contractaddress}, {@code senderaddress} and {@code txid}
     */
    @NonNull
    default JsonNode publishContract(@NonNull final Path artifact) {
        requireNonNull(artifact);
        return call("publishcontract", artifact.toString());
    }

    /**
     * Calls a function of a published contract.
     *
     * @param broadcast       whether the resulting transaction is broadcast
     * @param amount          the amount sent along with the call
     * @param contractAddress the address of the contract
     * @param sender          the address paying for the call
     * @param function        the name of the contract function
     * @param args            the function arguments
     * @return the node's answer, passed through unchanged
     */
    @NonNull
    default JsonNode callContract(
            final boolean broadcast,
            @NonNull final BigDecimal amount,
            @NonNull final String contractAddress,
            @NonNull final String sender,
            @NonNull final String function,
            @NonNull final List<?> args) {
        requireNonNull(amount);
        requireNonNull(contractAddress);
        requireNonNull(sender);
        requireNonNull(function);
        requireNonNull(args);
        final List<Object> params = new ArrayList<>(args.size() + 5);
        params.add(broadcast);
        params.add(amount);
        params.add(contractAddress);
        params.add(sender);
        params.add(function);
        params.addAll(args);
        return call("callcontract", params.toArray());
    }

    @NonNull
    default BigDecimal getBalanceOf(@NonNull final String address) {
        requireNonNull(address);
        return call("getbalanceof", address).decimalValue();
    }
}
