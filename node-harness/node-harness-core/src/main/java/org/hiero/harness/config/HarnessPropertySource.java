// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.config;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A flat source of string-valued harness properties with typed accessors.
 */
public interface HarnessPropertySource {

    /** Prefix of every property understood by the harness. */
    String PREFIX = "harness.";

    /** Name of the classpath resource that holds the default values. */
    String DEFAULTS_RESOURCE = "harness-default.properties";

    /**
     * Pattern for compact durations such as {@code 50ms}, {@code 1s}, {@code 2m} or {@code 1h}.
     */
    Pattern COMPACT_DURATION = Pattern.compile("(\\d+)\\s*(ms|s|m|h)");

    /**
     * Returns the raw value of a property.
     *
     * @param property the property name
     * @return the value
     * @throws IllegalArgumentException if the property is not defined
     */
    @NonNull
    String get(@NonNull String property);

    /**
     * Checks whether a property is defined.
     *
     * @param property the property name
     * @return {@code true} if the property has a value
     */
    boolean has(@NonNull String property);

    /**
     * Returns the defaults bundled with the harness.
     *
     * @return the default property source
     */
    @NonNull
    static HarnessPropertySource defaults() {
        return new JutilPropertySource(DEFAULTS_RESOURCE);
    }

    /**
     * Returns a source over the JVM system properties that start with {@link #PREFIX}.
     *
     * @return the system property source
     */
    @NonNull
    static HarnessPropertySource fromSystemProperties() {
        final Properties system = System.getProperties();
        final Map<String, String> harnessProperties = system.stringPropertyNames().stream()
                .filter(name -> name.startsWith(PREFIX))
                .collect(Collectors.toMap(name -> name, system::getProperty));
        return new MapPropertySource(harnessProperties);
    }

    /**
     * Layers the given sources, the first source that defines a property wins.
     *
     * @param sources the sources, highest priority first
     * @return the layered source
     */
    @NonNull
    static HarnessPropertySource inPriorityOrder(@NonNull final HarnessPropertySource... sources) {
        if (sources.length == 0) {
            throw new IllegalArgumentException("At least one property source is required");
        }
        if (sources.length == 1) {
            return requireNonNull(sources[0]);
        }
        final HarnessPropertySource overrides = requireNonNull(sources[0]);
        final HarnessPropertySource defaults = inPriorityOrder(Arrays.copyOfRange(sources, 1, sources.length));
        return new HarnessPropertySource() {
            @NonNull
            @Override
            public String get(@NonNull final String property) {
                return overrides.has(property) ? overrides.get(property) : defaults.get(property);
            }

            @Override
            public boolean has(@NonNull final String property) {
                return overrides.has(property) || defaults.has(property);
            }
        };
    }

    @NonNull
    default String getString(@NonNull final String property) {
        return get(property).trim();
    }

    default int getInteger(@NonNull final String property) {
        return Integer.parseInt(getString(property));
    }

    default long getLong(@NonNull final String property) {
        return Long.parseLong(getString(property));
    }

    default boolean getBoolean(@NonNull final String property) {
        return Boolean.parseBoolean(getString(property));
    }

    /**
     * Parses a duration written either compactly ({@code 50ms}, {@code 60s}, {@code 2m}, {@code 1h}) or in ISO-8601
     * form ({@code PT1S}).
     *
     * @param property the property name
     * @return the parsed duration
     * @throws IllegalArgumentException if the value is not a valid duration
     */
    @NonNull
    default Duration getDuration(@NonNull final String property) {
        final String value = getString(property).toLowerCase(Locale.ROOT);
        final Matcher matcher = COMPACT_DURATION.matcher(value);
        if (matcher.matches()) {
            final long amount = Long.parseLong(matcher.group(1));
            return switch (matcher.group(2)) {
                case "ms" -> Duration.ofMillis(amount);
                case "s" -> Duration.ofSeconds(amount);
                case "m" -> Duration.ofMinutes(amount);
                default -> Duration.ofHours(amount);
            };
        }
        try {
            return Duration.parse(value.toUpperCase(Locale.ROOT));
        } catch (final DateTimeParseException e) {
            throw new IllegalArgumentException(
                    "Property '%s' has invalid duration value '%s'".formatted(property, value), e);
        }
    }
}
