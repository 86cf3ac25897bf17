// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.contract.assertions;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import org.assertj.core.api.Assertions;
import org.hiero.harness.contract.CallResult;

/**
 * Entry point for the {@code assertThat()} methods of the harness, on top of the standard AssertJ ones.
 */
public class HarnessAssertions extends Assertions {

    private HarnessAssertions() {}

    /**
     * Creates an assertion for the given {@link CallResult}.
     *
     * @param result the {@link CallResult} to assert
     * @return an assertion for the given {@link CallResult}
     */
    @NonNull
    public static CallResultAssert assertThat(@Nullable final CallResult result) {
        return CallResultAssert.assertThat(result);
    }
}
