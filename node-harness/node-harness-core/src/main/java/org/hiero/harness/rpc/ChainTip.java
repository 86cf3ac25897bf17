// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.rpc;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The tip of a node's chain.
 *
 * @param height the block height
 * @param hash   the hash of the block at that height
 */
public record ChainTip(long height, @NonNull String hash) {

    public ChainTip {
        requireNonNull(hash, "hash must not be null");
    }

    /**
     * Reads a tip from a {@code {"height": ..., "hash": ...}} object.
     *
     * @param json the JSON object
     * @return the tip
     */
    @NonNull
    public static ChainTip fromJson(@NonNull final JsonNode json) {
        requireNonNull(json);
        return new ChainTip(json.path("height").asLong(), json.path("hash").asText(""));
    }

    @Override
    public String toString() {
        return "{height=" + height + ", hash=" + hash + "}";
    }
}
