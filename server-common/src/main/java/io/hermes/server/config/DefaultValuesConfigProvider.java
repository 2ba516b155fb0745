package io.hermes.server.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import jakarta.enterprise.context.ApplicationScoped;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link A2AConfigProvider} that reads every {@value #DEFAULTS_RESOURCE} on the classpath and lets
 * JVM system properties override the values found there.
 * <p>
 * Explicit overrides passed to {@link #DefaultValuesConfigProvider(Map)} take precedence over both,
 * which is how tests and embedding applications tune the engine.
 */
@ApplicationScoped
public class DefaultValuesConfigProvider implements A2AConfigProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultValuesConfigProvider.class);

    public static final String DEFAULTS_RESOURCE = "META-INF/hermes-a2a-defaults.properties";

    private final Map<String, String> defaults;
    private final Map<String, String> overrides;

    public DefaultValuesConfigProvider() {
        this(Map.of());
    }

    public DefaultValuesConfigProvider(Map<String, String> overrides) {
        this.defaults = loadDefaults();
        this.overrides = Map.copyOf(overrides);
    }

    @Override
    public String getValue(String name) {
        return getOptionalValue(name)
                .orElseThrow(() -> new IllegalArgumentException("No configuration value for " + name));
    }

    @Override
    public Optional<String> getOptionalValue(String name) {
        String value = overrides.get(name);
        if (value == null) {
            value = System.getProperty(name);
        }
        if (value == null) {
            value = defaults.get(name);
        }
        return Optional.ofNullable(value);
    }

    private static Map<String, String> loadDefaults() {
        Map<String, String> values = new HashMap<>();
        ClassLoader classLoader = DefaultValuesConfigProvider.class.getClassLoader();
        try {
            Enumeration<URL> resources = classLoader.getResources(DEFAULTS_RESOURCE);
            while (resources.hasMoreElements()) {
                URL url = resources.nextElement();
                Properties properties = new Properties();
                try (InputStream in = url.openStream()) {
                    properties.load(in);
                }
                for (String key : properties.stringPropertyNames()) {
                    String previous = values.put(key, properties.getProperty(key));
                    if (previous != null) {
                        LOGGER.warn("Duplicate default for {} in {}", key, url);
                    }
                }
                LOGGER.debug("Loaded {} default values from {}", properties.size(), url);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + DEFAULTS_RESOURCE, e);
        }
        return values;
    }
}
