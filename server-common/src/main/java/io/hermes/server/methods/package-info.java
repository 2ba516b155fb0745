/**
 * Handlers of the JSON-RPC method surface, one class per method namespace.
 */
@NullMarked
package io.hermes.server.methods;

import org.jspecify.annotations.NullMarked;
