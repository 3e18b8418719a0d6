package com.tandem.core.store;

import com.tandem.core.model.InteractionLogEntry;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory {@link InteractionLedger}. Appends come from {@link InMemoryTaskStore}.
 */
public class InMemoryInteractionLedger implements InteractionLedger {

    private static final Comparator<InteractionLogEntry> OLDEST_FIRST =
            Comparator.comparing(InteractionLogEntry::createdAt).thenComparing(InteractionLogEntry::id);

    private final CopyOnWriteArrayList<InteractionLogEntry> entries = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public List<InteractionLogEntry> findByTask(long taskId) {
        return entries.stream()
                .filter(e -> e.taskId() == taskId)
                .sorted(OLDEST_FIRST)
                .toList();
    }

    @Override
    public Optional<InteractionLogEntry> findLatestHumanResponse(String sessionId, Instant after) {
        return entries.stream()
                .filter(e -> e.sessionId().equals(sessionId))
                .filter(InteractionLogEntry::isHumanResponse)
                .filter(e -> e.createdAt().isAfter(after))
                .max(OLDEST_FIRST);
    }

    InteractionLogEntry append(InteractionLogEntry entry) {
        InteractionLogEntry stored = entry.withId(sequence.incrementAndGet());
        entries.add(stored);
        return stored;
    }
}
