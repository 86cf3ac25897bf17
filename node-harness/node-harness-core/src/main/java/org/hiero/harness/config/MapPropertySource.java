// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.config;

import static java.util.Objects.requireNonNull;

import com.google.common.base.MoreObjects;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Map;

/**
 * A {@link HarnessPropertySource} over an in-memory map.
 */
public class MapPropertySource implements HarnessPropertySource {

    private final Map<String, String> props;

    public MapPropertySource(@NonNull final Map<String, String> props) {
        this.props = Map.copyOf(requireNonNull(props));
    }

    @NonNull
    @Override
    public String get(@NonNull final String property) {
        final String value = props.get(requireNonNull(property));
        if (value == null) {
            throw new IllegalArgumentException("Property '" + property + "' is not defined");
        }
        return value;
    }

    @Override
    public boolean has(@NonNull final String property) {
        return props.containsKey(requireNonNull(property));
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("props", props).toString();
    }
}
