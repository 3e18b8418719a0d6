package com.tandem.core.store;

import com.tandem.core.model.NewTask;
import com.tandem.core.model.Task;
import com.tandem.core.model.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable record of tasks.
 * <p>
 * Every read goes to the backing store; implementations keep no caller-visible snapshot.
 */
public interface TaskStore {

    Optional<Task> findById(long taskId);

    /**
     * Tasks of a project created strictly after {@code after} whose status is in
     * {@code statuses}, ordered by creation time ascending.
     */
    List<Task> findCreatedAfter(long projectId, Instant after, Set<TaskStatus> statuses);

    /** Most recently updated tasks across all projects, newest first. */
    List<Task> findRecent(int limit);

    Task insert(NewTask newTask);

    /**
     * Atomically applies a transition: the task row, the optional ledger entry and the
     * project's last-activity timestamp are written together or not at all.
     *
     * @return the committed transition, with the task's bumped version and the entry's id
     * @throws com.tandem.core.error.InteractionException with kind {@code CONFLICT} when
     *         the stored version no longer matches {@code transition.previous().version()}
     */
    TaskTransition commit(TaskTransition transition);
}
