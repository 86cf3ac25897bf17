// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.port;

/**
 * The classes of ports a node listens on. Each class owns its own reserved range.
 */
public enum PortType {
    /** Peer-to-peer gossip port. */
    P2P,
    /** JSON-RPC port. */
    RPC
}
