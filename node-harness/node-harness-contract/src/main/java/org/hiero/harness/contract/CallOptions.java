// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.contract;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.math.BigDecimal;
import org.hiero.harness.rpc.NodeRpc;

/**
 * Per-call options of a {@link Caller}.
 *
 * @param sender       the address paying for the call, {@code null} to let the caller pick one
 * @param amount       the amount sent with the call, {@code null} for a random amount in {@code [1, 10000]}
 * @param throwOnError whether a failed call throws or yields a failed {@link CallResult}
 * @param broadcast    whether the resulting transaction is broadcast
 * @param executeOn    the node executing the call instead of the contract's own node, or {@code null}
 * @param debug        whether the invocation is logged at INFO
 */
public record CallOptions(
        @Nullable String sender,
        @Nullable BigDecimal amount,
        boolean throwOnError,
        boolean broadcast,
        @Nullable NodeRpc executeOn,
        boolean debug) {

    private static final CallOptions DEFAULTS = new CallOptions(null, null, true, true, null, false);

    public CallOptions {
        if (amount != null && amount.signum() < 0) {
            throw new IllegalArgumentException("amount must not be negative");
        }
    }

    /**
     * Returns the default options: random amount, broadcast, throw on error, executed on the contract's node.
     *
     * @return the default options
     */
    @NonNull
    public static CallOptions defaults() {
        return DEFAULTS;
    }

    @NonNull
    public CallOptions withSender(@NonNull final String sender) {
        return new CallOptions(requireNonNull(sender), amount, throwOnError, broadcast, executeOn, debug);
    }

    @NonNull
    public CallOptions withAmount(@NonNull final BigDecimal amount) {
        return new CallOptions(sender, requireNonNull(amount), throwOnError, broadcast, executeOn, debug);
    }

    @NonNull
    public CallOptions withAmount(final long amount) {
        return withAmount(BigDecimal.valueOf(amount));
    }

    @NonNull
    public CallOptions withThrowOnError(final boolean throwOnError) {
        return new CallOptions(sender, amount, throwOnError, broadcast, executeOn, debug);
    }

    @NonNull
    public CallOptions withBroadcast(final boolean broadcast) {
        return new CallOptions(sender, amount, throwOnError, broadcast, executeOn, debug);
    }

    @NonNull
    public CallOptions withExecuteOn(@NonNull final NodeRpc executeOn) {
        return new CallOptions(sender, amount, throwOnError, broadcast, requireNonNull(executeOn), debug);
    }

    @NonNull
    public CallOptions withDebug(final boolean debug) {
        return new CallOptions(sender, amount, throwOnError, broadcast, executeOn, debug);
    }
}
