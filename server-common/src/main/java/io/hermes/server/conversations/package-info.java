@NullMarked
package io.hermes.server.conversations;

import org.jspecify.annotations.NullMarked;
