// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.port;

/**
 * An inclusive range of ports.
 *
 * @param first the lowest port in the window
 * @param last  the highest port in the window
 */
public record PortWindow(int first, int last) {

    public PortWindow {
        if (first > last) {
            throw new IllegalArgumentException("Empty port window [%d, %d]".formatted(first, last));
        }
    }

    public boolean contains(final int port) {
        return port >= first && port <= last;
    }

    public boolean overlaps(final PortWindow other) {
        return first <= other.last && other.first <= last;
    }
}
