// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.rpc;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Locale;

/**
 * The commands understood by the {@code addnode} RPC.
 */
public enum AddNodeCommand {
    /** Adds the peer to the persistent peer list. */
    ADD,
    /** Removes the peer from the persistent peer list. */
    REMOVE,
    /** Tries a single connection to the peer. */
    ONETRY;

    @NonNull
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
