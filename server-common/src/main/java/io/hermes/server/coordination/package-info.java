/**
 * Workflows: tasks scheduled under a dependency graph by the
 * {@link io.hermes.server.coordination.TaskCoordinator}.
 */
@NullMarked
package io.hermes.server.coordination;

import org.jspecify.annotations.NullMarked;
