@NullMarked
package io.hermes.server.bus;

import org.jspecify.annotations.NullMarked;
