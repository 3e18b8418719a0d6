package com.tandem.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Immutable record of one feedback or response event within an interaction session.
 *
 * @param id        store-assigned identifier, null until appended
 * @param taskId    task the event belongs to
 * @param sessionId interaction session
 * @param type      agent feedback or human response
 * @param status    resolution carried by the entry
 * @param content   free text submitted with the event
 * @param metadata  free-form key/value context
 * @param createdAt when the event was recorded
 * @param createdBy {@code AI} for agent entries, {@code user_<id>} for human entries
 */
public record InteractionLogEntry(
    Long id,
    long taskId,
    String sessionId,
    InteractionType type,
    InteractionStatus status,
    String content,
    Map<String, Object> metadata,
    Instant createdAt,
    String createdBy
) implements Serializable {

    public static final String AI_AUTHOR = "AI";

    public InteractionLogEntry {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public InteractionLogEntry withId(long newId) {
        return new InteractionLogEntry(newId, taskId, sessionId, type, status, content, metadata, createdAt, createdBy);
    }

    public boolean isHumanResponse() {
        return type == InteractionType.HUMAN_RESPONSE;
    }
}
