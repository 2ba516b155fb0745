@NullMarked
package io.hermes.server.registry;

import org.jspecify.annotations.NullMarked;
