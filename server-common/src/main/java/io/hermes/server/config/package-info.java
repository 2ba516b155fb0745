/**
 * Configuration of the engine, read from {@code META-INF/hermes-a2a-defaults.properties} and
 * overridden by system properties.
 */
@NullMarked
package io.hermes.server.config;

import org.jspecify.annotations.NullMarked;
