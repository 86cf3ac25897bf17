// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.contract;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.nio.file.Path;

/**
 * Thrown when a contract is used before it was published.
 */
public class NotPublishedException extends IllegalStateException {

    public NotPublishedException(@NonNull final Path artifact) {
        super("Contract " + artifact + " is not published, it can not be called");
    }
}
