// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.contract;

import static java.util.Objects.requireNonNull;

import com.google.common.base.MoreObjects;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.Random;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.harness.rpc.NodeRpc;

/**
 * A smart contract bound to one node.
 *
 * <p>A new instance is unpublished. {@link #publish()} deploys it once; afterwards the contract's functions can be
 * called through {@link Caller}s. Instances are not thread-safe and belong to the test that created them.
 */
public class Contract {

    private static final Logger log = LogManager.getLogger(Contract.class);

    /** Prefix of the symbolic names that {@link #resolve(String)} turns into callers. */
    public static final String CALL_PREFIX = "call_";

    private final NodeRpc endpoint;
    private final Path artifact;
    private final boolean debug;
    private final Random random;

    @Nullable
    private PublishReceipt receipt;

    /**
     * Creates an unpublished contract.
     *
     * @param endpoint the node the contract is published on and called through
     * @param artifact the path of the contract source
     */
    public Contract(@NonNull final NodeRpc endpoint, @NonNull final Path artifact) {
        this(endpoint, artifact, false);
    }

    /**
     * Creates an unpublished contract.
     *
     * @param endpoint the node the contract is published on and called through
     * @param artifact the path of the contract source
     * @param debug    whether every call of the contract is logged at INFO
     */
    public Contract(@NonNull final NodeRpc endpoint, @NonNull final Path artifact, final boolean debug) {
        this(endpoint, artifact, debug, new Random());
    }

    Contract(
            @NonNull final NodeRpc endpoint,
            @NonNull final Path artifact,
            final boolean debug,
            @NonNull final Random random) {
        this.endpoint = requireNonNull(endpoint);
        this.artifact = requireNonNull(artifact);
        this.debug = debug;
        this.random = requireNonNull(random);
    }

    /**
     * Publishes the contract unless it is published already.
     *
     * @return this contract
     * @throws org.hiero.harness.rpc.RpcException if the node rejected the contract, in which case it stays unpublished
     */
    @NonNull
    public Contract publish() {
        if (receipt == null) {
            receipt = PublishReceipt.fromJson(endpoint.publishContract(artifact));
            log.info(
                    "Published {} on {} at {} in transaction {}",
                    artifact,
                    endpoint.name(),
                    receipt.contractAddress(),
                    receipt.txId());
        }
        return this;
    }

    public boolean isPublished() {
        return receipt != null;
    }

    /**
     * Returns the publication details.
     *
     * @return the receipt of the publication
     * @throws NotPublishedException if the contract is not published
     */
    @NonNull
    public PublishReceipt receipt() {
        if (receipt == null) {
            throw new NotPublishedException(artifact);
        }
        return receipt;
    }

    @NonNull
    public String address() {
        return receipt().contractAddress();
    }

    @NonNull
    public String publisher() {
        return receipt().senderAddress();
    }

    @NonNull
    public String publishTransactionId() {
        return receipt().txId();
    }

    /**
     * Returns a caller for a function of this contract. The publisher is the caller's default sender.
     *
     * @param function the name of the function
     * @return the caller
     * @throws NotPublishedException    if the contract is not published
     * @throws IllegalArgumentException if the function name is blank
     */
    @NonNull
    public Caller caller(@NonNull final String function) {
        requireNonNull(function);
        final PublishReceipt published = receipt();
        if (function.isBlank()) {
            throw new IllegalArgumentException("function must not be blank");
        }
        return new Caller(endpoint, function, published.contractAddress(), published.senderAddress(), debug, random);
    }

    /**
     * Resolves a symbolic name of the form {@code call_<function>} into a caller.
     *
     * @param name the symbolic name
     * @return the caller for {@code <function>}
     * @throws NotPublishedException     if the contract is not published, checked before the name
     * @throws UnknownAttributeException if the name does not follow the pattern
     */
    @NonNull
    public Caller resolve(@NonNull final String name) {
        requireNonNull(name);
        receipt();
        if (!name.startsWith(CALL_PREFIX) || name.length() == CALL_PREFIX.length()) {
            throw new UnknownAttributeException(name);
        }
        return caller(name.substring(CALL_PREFIX.length()));
    }

    /**
     * Returns the balance of this contract as seen by its own node.
     *
     * @return the balance
     * @throws NotPublishedException if the contract is not published
     */
    @NonNull
    public BigDecimal balance() {
        return balance(endpoint);
    }

    /**
     * Returns the balance of this contract as seen by the given node.
     *
     * @param node the node to ask
     * @return the balance
     * @throws NotPublishedException if the contract is not published
     */
    @NonNull
    public BigDecimal balance(@NonNull final NodeRpc node) {
        requireNonNull(node);
        return node.getBalanceOf(address());
    }

    @NonNull
    public NodeRpc endpoint() {
        return endpoint;
    }

    @NonNull
    public Path artifact() {
        return artifact;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("artifact", artifact)
                .add("endpoint", endpoint.name())
                .add("receipt", receipt)
                .toString();
    }
}
