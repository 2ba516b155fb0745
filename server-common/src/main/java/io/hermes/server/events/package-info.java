/**
 * Channels, pattern subscriptions and streaming of domain events to SSE and WebSocket consumers.
 */
@NullMarked
package io.hermes.server.events;

import org.jspecify.annotations.NullMarked;
