// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.config;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A {@link HarnessPropertySource} loaded from a {@code .properties} resource on the classpath.
 */
public class JutilPropertySource implements HarnessPropertySource {

    private static final Logger log = LogManager.getLogger(JutilPropertySource.class);

    private final Properties props = new Properties();

    /**
     * Loads the given classpath resource. A missing resource yields an empty source.
     *
     * @param resource the resource name, relative to the classpath root
     */
    public JutilPropertySource(@NonNull final String resource) {
        requireNonNull(resource);
        final ClassLoader classLoader = JutilPropertySource.class.getClassLoader();
        try (final InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                log.warn("Property resource '{}' not found on the classpath", resource);
            } else {
                props.load(in);
            }
        } catch (final IOException e) {
            throw new UncheckedIOException("Unable to load property resource '" + resource + "'", e);
        }
    }

    @NonNull
    @Override
    public String get(@NonNull final String property) {
        final String value = props.getProperty(requireNonNull(property));
        if (value == null) {
            throw new IllegalArgumentException("Property '" + property + "' is not defined");
        }
        return value;
    }

    @Override
    public boolean has(@NonNull final String property) {
        return props.containsKey(requireNonNull(property));
    }
}
