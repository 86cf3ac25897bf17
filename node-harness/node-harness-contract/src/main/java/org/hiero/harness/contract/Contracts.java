// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.contract;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.harness.rpc.NodeRpc;

/**
 * Bulk operations on contracts.
 */
public final class Contracts {

    private static final Logger log = LogManager.getLogger(Contracts.class);

    private Contracts() {}

    /**
     * Publishes the same contract source many times, to fill blocks with contract transactions.
     *
     * @param endpoint the node to publish on
     * @param artifact the path of the contract source
     * @param count    the number of publications
     * @return the receipt of every publication, in order
     */
    @NonNull
    public static List<PublishReceipt> publishMany(
            @NonNull final NodeRpc endpoint, @NonNull final Path artifact, final int count) {
        requireNonNull(endpoint);
        requireNonNull(artifact);
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative");
        }
        final List<PublishReceipt> receipts = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            receipts.add(PublishReceipt.fromJson(endpoint.publishContract(artifact)));
        }
        log.info("Published {} {} time(s) on {}", artifact, count, endpoint.name());
        return receipts;
    }
}
