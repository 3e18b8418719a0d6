package com.tandem.core.store;

import com.tandem.core.model.InteractionLogEntry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the append-only interaction log. Entries are appended only through
 * {@link TaskStore#commit(TaskTransition)} so that they never diverge from the task row.
 */
public interface InteractionLedger {

    /** All entries for a task, oldest first. */
    List<InteractionLogEntry> findByTask(long taskId);

    /** Newest human response in the session created strictly after {@code after}. */
    Optional<InteractionLogEntry> findLatestHumanResponse(String sessionId, Instant after);
}
