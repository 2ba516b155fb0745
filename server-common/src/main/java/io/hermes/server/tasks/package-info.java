@NullMarked
package io.hermes.server.tasks;

import org.jspecify.annotations.NullMarked;
