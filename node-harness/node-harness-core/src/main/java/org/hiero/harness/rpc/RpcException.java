// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.rpc;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A structured error returned by a node in answer to an RPC request.
 */
public class RpcException extends RuntimeException {

    private final String method;
    private final int code;
    private final String rpcMessage;

    /**
     * Creates a new exception.
     *
     * @param method     the RPC method that failed
     * @param code       the error code reported by the node
     * @param rpcMessage the error message reported by the node
     */
    public RpcException(@NonNull final String method, final int code, @NonNull final String rpcMessage) {
        super("%s (%d)".formatted(requireNonNull(rpcMessage), code));
        this.method = requireNonNull(method);
        this.code = code;
        this.rpcMessage = rpcMessage;
    }

    @NonNull
    public String method() {
        return method;
    }

    public int code() {
        return code;
    }

    @NonNull
    public String rpcMessage() {
        return rpcMessage;
    }

    @Override
    public String toString() {
        return "RpcException{method=%s, code=%d, message=%s}".formatted(method, code, rpcMessage);
    }
}
