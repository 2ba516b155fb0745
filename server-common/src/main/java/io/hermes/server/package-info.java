/**
 * Server side of the Hermes agent communication engine.
 *
 * <p>{@link io.hermes.server.A2AService} composes the components of the sub-packages:
 * <ul>
 *   <li>{@code registry}: agent cards, liveness and discovery</li>
 *   <li>{@code security}: tokens, role based access control and event signing</li>
 *   <li>{@code dispatch}: the JSON-RPC method dispatcher and its interceptor chain</li>
 *   <li>{@code tasks}: the task lifecycle state machine</li>
 *   <li>{@code coordination}: dependency ordered workflows</li>
 *   <li>{@code conversations}: turn-taking conversations</li>
 *   <li>{@code events}: channels, subscriptions and event streaming</li>
 *   <li>{@code methods}: the handlers of the RPC method surface</li>
 * </ul>
 */
@NullMarked
package io.hermes.server;

import org.jspecify.annotations.NullMarked;
