// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.time;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;

/**
 * A source of monotonic time that can also block the calling thread. Polling loops read the clock and sleep through
 * this interface so that tests can substitute a simulated clock.
 */
public interface Time {

    /**
     * Returns the OS-backed implementation.
     *
     * @return the time source backed by {@link System#nanoTime()} and {@link Thread#sleep(long)}
     */
    @NonNull
    static Time getCurrent() {
        return OsTime.getInstance();
    }

    /**
     * Returns the current value of a monotonic clock in nanoseconds. Only differences between two values are
     * meaningful.
     *
     * @return the current monotonic time in nanoseconds
     */
    long nanoTime();

    /**
     * Blocks the calling thread for the given duration.
     *
     * @param duration the time to sleep, {@link Duration#ZERO} returns immediately
     * @throws InterruptedException if the thread is interrupted while sleeping
     */
    void sleep(@NonNull Duration duration) throws InterruptedException;
}
