package com.tandem.core.store;

import com.tandem.core.error.InteractionException;
import com.tandem.core.model.InteractionLogEntry;
import com.tandem.core.model.NewTask;
import com.tandem.core.model.Task;
import com.tandem.core.model.TaskStatus;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory {@link TaskStore}. Commits are serialized on the store monitor so the
 * version check, task write, ledger append and activity touch happen as one step.
 * State is lost on restart.
 */
public class InMemoryTaskStore implements TaskStore {

    private final ConcurrentHashMap<Long, Task> tasks = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final InMemoryInteractionLedger ledger;
    private final InMemoryProjectStore projects;
    private final Clock clock;

    public InMemoryTaskStore(InMemoryInteractionLedger ledger, InMemoryProjectStore projects, Clock clock) {
        this.ledger = ledger;
        this.projects = projects;
        this.clock = clock;
    }

    @Override
    public Optional<Task> findById(long taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public List<Task> findCreatedAfter(long projectId, Instant after, Set<TaskStatus> statuses) {
        return tasks.values().stream()
                .filter(t -> t.projectId() == projectId)
                .filter(t -> t.createdAt().isAfter(after))
                .filter(t -> statuses.contains(t.status()))
                .sorted(Comparator.comparing(Task::createdAt).thenComparingLong(Task::id))
                .toList();
    }

    @Override
    public List<Task> findRecent(int limit) {
        return tasks.values().stream()
                .sorted(Comparator.comparing(Task::updatedAt).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized Task insert(NewTask newTask) {
        if (projects.findById(newTask.projectId()).isEmpty()) {
            throw InteractionException.notFound("Project with ID " + newTask.projectId() + " not found");
        }
        Instant now = clock.instant();
        Task task = new Task(sequence.incrementAndGet(), newTask.projectId(), newTask.creatorId(),
                newTask.title(), newTask.content(), newTask.status(), newTask.interactive(),
                false, null, null, null, now, now, null, 0L);
        tasks.put(task.id(), task);
        projects.touchActivity(task.projectId(), now);
        return task;
    }

    @Override
    public synchronized TaskTransition commit(TaskTransition transition) {
        Task previous = transition.previous();
        Task current = tasks.get(previous.id());
        if (current == null) {
            throw InteractionException.notFound("Task with ID " + previous.id() + " not found");
        }
        if (current.version() != previous.version()) {
            throw InteractionException.conflict("Task " + previous.id() + " was modified concurrently (expected version "
                    + previous.version() + ", found " + current.version() + ")");
        }

        Task stored = transition.next().withCommit(transition.occurredAt(), previous.version() + 1);
        InteractionLogEntry storedEntry = transition.ledgerEntry().map(ledger::append).orElse(null);
        tasks.put(stored.id(), stored);
        projects.touchActivity(stored.projectId(), transition.occurredAt());
        return transition.committed(stored, storedEntry);
    }
}
