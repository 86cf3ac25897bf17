// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.rpc;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One entry of a node's peer list.
 *
 * @param id         the node-local id of the peer connection
 * @param version    the negotiated protocol version, {@code 0} until the version handshake completed
 * @param subversion the user agent announced by the peer, which carries the test node identity
 */
public record PeerInfo(long id, int version, @NonNull String subversion) {

    private static final Pattern TEST_NODE = Pattern.compile("testnode(\\d+)");

    public PeerInfo {
        requireNonNull(subversion, "subversion must not be null");
    }

    /**
     * Reads a peer entry from a {@code getpeerinfo} element.
     *
     * @param json the JSON object
     * @return the peer entry
     */
    @NonNull
    public static PeerInfo fromJson(@NonNull final JsonNode json) {
        requireNonNull(json);
        return new PeerInfo(
                json.path("id").asLong(), json.path("version").asInt(0), json.path("subver").asText(""));
    }

    public boolean handshakeComplete() {
        return version != 0;
    }

    /**
     * Returns the index of the test node this peer belongs to, parsed from the {@code testnode<n>} token of its
     * subversion.
     *
     * @return the node index, or empty if the subversion carries no such token
     */
    @NonNull
    public OptionalInt nodeIndex() {
        final Matcher matcher = TEST_NODE.matcher(subversion);
        if (!matcher.find()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(matcher.group(1)));
        } catch (final NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    public boolean belongsTo(final int nodeIndex) {
        final OptionalInt index = nodeIndex();
        return index.isPresent() && index.getAsInt() == nodeIndex;
    }
}
