// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.contract;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.MoreObjects;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.harness.rpc.NodeRpc;

/**
 * A reusable handle for calling one function of a published contract.
 *
 * <p>The sender of a call is, in this order: the sender given in the {@link CallOptions}, a fresh address of the
 * node the call is redirected to, or the caller's default sender. Nothing of one call carries over to the next.
 */
public class Caller {

    private static final Logger log = LogManager.getLogger(Caller.class);

    /** Upper bound of the random amount used when a call does not specify one. */
    static final int MAX_RANDOM_AMOUNT = 10_000;

    private final NodeRpc endpoint;
    private final String function;
    private final String contractAddress;
    private final String defaultSender;
    private final boolean debug;
    private final Random random;

    @Nullable
    private String lastSender;

    Caller(
            @NonNull final NodeRpc endpoint,
            @NonNull final String function,
            @NonNull final String contractAddress,
            @NonNull final String defaultSender,
            final boolean debug,
            @NonNull final Random random) {
        this.endpoint = requireNonNull(endpoint);
        this.function = requireNonNull(function);
        this.contractAddress = requireNonNull(contractAddress);
        this.defaultSender = requireNonNull(defaultSender);
        this.debug = debug;
        this.random = requireNonNull(random);
    }

    /**
     * Calls the function with default options.
     *
     * @param args the function arguments
     * @return the result of the call
     * @see #invoke(CallOptions, Object...)
     */
    @NonNull
    public CallResult invoke(@NonNull final Object... args) {
        return invoke(CallOptions.defaults(), args);
    }

    /**
     * Calls the function.
     *
     * @param options the options of this call
     * @param args    the function arguments
     * @return the result of the call, a failed result only if {@link CallOptions#throwOnError()} is {@code false}
     * @throws RuntimeException the failure of the call, unchanged, if {@link CallOptions#throwOnError()} is set
     */
    @NonNull
    public CallResult invoke(@NonNull final CallOptions options, @NonNull final Object... args) {
        requireNonNull(options);
        requireNonNull(args);
        final NodeRpc target = options.executeOn() != null ? options.executeOn() : endpoint;
        final BigDecimal amount = options.amount() != null ? options.amount() : randomAmount();
        final List<Object> arguments = Arrays.asList(args);
        lastSender = null;
        try {
            final String sender = resolveSender(options);
            lastSender = sender;
            log.log(
                    debug || options.debug() ? Level.INFO : Level.DEBUG,
                    "Calling {}.{} from {} with amount {} on {}, args {}",
                    contractAddress,
                    function,
                    sender,
                    amount,
                    target.name(),
                    arguments);
            final JsonNode payload =
                    target.callContract(options.broadcast(), amount, contractAddress, sender, function, arguments);
            return CallResult.success(payload);
        } catch (final RuntimeException e) {
            if (options.throwOnError()) {
                throw e;
            }
            log.warn("Call of {}.{} failed: {}", contractAddress, function, e.toString());
            return CallResult.failure(e.toString());
        }
    }

    @NonNull
    private String resolveSender(@NonNull final CallOptions options) {
        if (options.sender() != null) {
            return options.sender();
        }
        if (options.executeOn() != null) {
            return options.executeOn().getNewAddress();
        }
        return defaultSender;
    }

    @NonNull
    private BigDecimal randomAmount() {
        return BigDecimal.valueOf(random.nextInt(MAX_RANDOM_AMOUNT) + 1L);
    }

    @NonNull
    public String function() {
        return function;
    }

    @NonNull
    public String contractAddress() {
        return contractAddress;
    }

    @NonNull
    public String defaultSender() {
        return defaultSender;
    }

    /**
     * Returns the sender of the most recent call.
     *
     * @return the sender, or {@code null} if the caller was never invoked or the last call failed to resolve a sender
     */
    @Nullable
    public String lastSender() {
        return lastSender;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("contract", contractAddress)
                .add("function", function)
                .add("endpoint", endpoint.name())
                .toString();
    }
}
