/**
 * JSON-RPC 2.0 and streaming handlers of the Hermes A2A engine.
 *
 * <p>{@link io.hermes.transport.jsonrpc.handler.JSONRPCHandler} turns raw request bodies,
 * received over HTTP or as WebSocket text frames, into dispatcher calls and serialised responses.
 * It supports:
 * <ul>
 *   <li>Request/response pairs with string or number ids</li>
 *   <li>Batches, answered in request order</li>
 *   <li>Notifications, which are never answered</li>
 *   <li>Error responses with code, message, and optional data</li>
 * </ul>
 *
 * <p>{@link io.hermes.transport.jsonrpc.handler.StreamingHandler} manages the SSE and WebSocket
 * connections that receive domain events.
 *
 * @see io.hermes.server.dispatch.MethodDispatcher
 */
@NullMarked
package io.hermes.transport.jsonrpc.handler;

import org.jspecify.annotations.NullMarked;
