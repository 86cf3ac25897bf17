// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.time;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;

/**
 * {@link Time} backed by the operating system clock.
 */
public final class OsTime implements Time {

    private static final OsTime INSTANCE = new OsTime();

    private OsTime() {}

    /**
     * Returns the singleton instance.
     *
     * @return the OS time source
     */
    @NonNull
    public static OsTime getInstance() {
        return INSTANCE;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public long nanoTime() {
        return System.nanoTime();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void sleep(@NonNull final Duration duration) throws InterruptedException {
        requireNonNull(duration);
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
        }
    }
}
