package io.hermes.server.config;

import java.util.Optional;

/**
 * Source of engine configuration values.
 * <p>
 * Implementations may be backed by properties files, system properties or a framework's
 * configuration system.
 */
public interface A2AConfigProvider {

    /**
     * Returns the value for {@code name}.
     *
     * @param name the configuration key
     * @return the value
     * @throws IllegalArgumentException if no value is configured for the key
     */
    String getValue(String name);

    /**
     * Returns the value for {@code name}, if configured.
     *
     * @param name the configuration key
     * @return the value, or empty
     */
    Optional<String> getOptionalValue(String name);
}
