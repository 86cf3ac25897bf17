// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.contract;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when a symbolic name does not follow the {@code call_<function>} pattern.
 */
public class UnknownAttributeException extends IllegalArgumentException {

    private final String name;

    public UnknownAttributeException(@NonNull final String name) {
        super("Unknown contract attribute '" + name + "', expected " + Contract.CALL_PREFIX + "<function>");
        this.name = name;
    }

    @NonNull
    public String name() {
        return name;
    }
}
