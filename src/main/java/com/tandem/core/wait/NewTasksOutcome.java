package com.tandem.core.wait;

import com.tandem.core.model.Project;
import com.tandem.core.model.Task;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Result of waiting for new work in a project.
 *
 * @param project   the project that was watched
 * @param newTasks  open tasks created after {@code startedAt}, oldest first; empty on timeout
 * @param pollCount number of store evaluations performed
 * @param waited    time between the start of the wait and its resolution
 * @param startedAt instant before the first evaluation
 * @param timedOut  whether the wait expired without finding work
 * @param timeout   the effective (clamped) timeout
 */
public record NewTasksOutcome(
    Project project,
    List<Task> newTasks,
    int pollCount,
    Duration waited,
    Instant startedAt,
    boolean timedOut,
    Duration timeout
) {

    public NewTasksOutcome {
        newTasks = List.copyOf(newTasks);
    }
}
