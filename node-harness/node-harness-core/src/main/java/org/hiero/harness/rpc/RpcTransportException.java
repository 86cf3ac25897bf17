// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.rpc;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when an RPC request could not be delivered or its response could not be read.
 */
public class RpcTransportException extends RuntimeException {

    public RpcTransportException(@NonNull final String message) {
        super(message);
    }

    public RpcTransportException(@NonNull final String message, @NonNull final Throwable cause) {
        super(message, cause);
    }
}
