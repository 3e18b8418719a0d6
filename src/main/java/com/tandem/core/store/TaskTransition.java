package com.tandem.core.store;

import com.tandem.core.model.InteractionLogEntry;
import com.tandem.core.model.Task;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A single state-machine step: the task as it was read, the task as it should be
 * stored, and at most one ledger entry to append alongside it.
 *
 * @param previous   task as read; its version is the compare-and-swap expectation
 * @param next       task to store
 * @param entry      ledger entry to append, nullable
 * @param occurredAt commit time, also written as the project's last activity
 */
public record TaskTransition(
    Task previous,
    Task next,
    InteractionLogEntry entry,
    Instant occurredAt
) {

    public TaskTransition {
        Objects.requireNonNull(previous, "previous");
        Objects.requireNonNull(next, "next");
        Objects.requireNonNull(occurredAt, "occurredAt");
        if (previous.id() != next.id()) {
            throw new IllegalArgumentException("transition must not change task identity");
        }
    }

    public Optional<InteractionLogEntry> ledgerEntry() {
        return Optional.ofNullable(entry);
    }

    public boolean statusChanged() {
        return previous.status() != next.status();
    }

    TaskTransition committed(Task storedTask, InteractionLogEntry storedEntry) {
        return new TaskTransition(previous, storedTask, storedEntry, occurredAt);
    }
}
