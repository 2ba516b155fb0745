/**
 * SSE and WebSocket framing of domain events.
 */
@NullMarked
package io.hermes.transport.jsonrpc.streaming;

import org.jspecify.annotations.NullMarked;
