/**
 * Authentication and authorization.
 *
 * <p>{@link io.hermes.server.security.TokenManager} issues and validates bearer tokens,
 * {@link io.hermes.server.security.AccessControl} maps roles to method patterns and
 * {@link io.hermes.server.security.SecurityInterceptor} applies both to every non-exempt request.
 * {@link io.hermes.server.security.MessageSigner} signs streamed events.
 */
@NullMarked
package io.hermes.server.security;

import org.jspecify.annotations.NullMarked;
