@NullMarked
package io.hermes.server.dispatch;

import org.jspecify.annotations.NullMarked;
