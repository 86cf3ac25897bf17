// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.port;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Per-process integer from which a {@link PortAllocator} derives its port windows. Two test processes running in
 * parallel must use different seeds.
 *
 * @param value the seed, never negative
 */
public record PortSeed(int value) {

    public PortSeed {
        if (value < 0) {
            throw new IllegalArgumentException("Port seed must not be negative: " + value);
        }
    }

    /**
     * Creates a seed with the given value.
     *
     * @param value the seed value
     * @return the seed
     */
    @NonNull
    public static PortSeed of(final int value) {
        return new PortSeed(value);
    }

    /**
     * Derives a seed from the id of the current process, which is unique among the processes alive at the same time.
     *
     * @return the seed of this process
     */
    @NonNull
    public static PortSeed fromCurrentProcess() {
        return new PortSeed((int) (ProcessHandle.current().pid() & Integer.MAX_VALUE));
    }
}
