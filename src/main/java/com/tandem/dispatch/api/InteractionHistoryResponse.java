package com.tandem.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tandem.core.model.InteractionLogEntry;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JSON projection of a task's ledger, oldest entry first.
 */
public record InteractionHistoryResponse(
    @JsonProperty("task_id") long taskId,
    @JsonProperty("total_interactions") int totalInteractions,
    List<Entry> interactions
) {

    public record Entry(
        long id,
        @JsonProperty("task_id") long taskId,
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("interaction_type") String interactionType,
        String status,
        String content,
        Map<String, Object> metadata,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("created_by") String createdBy
    ) {
        static Entry from(InteractionLogEntry e) {
            return new Entry(e.id() == null ? 0L : e.id(), e.taskId(), e.sessionId(), e.type().wireValue(),
                    e.status().wireValue(), e.content(), e.metadata(), e.createdAt(), e.createdBy());
        }
    }

    public static InteractionHistoryResponse from(long taskId, List<InteractionLogEntry> entries) {
        List<Entry> interactions = entries.stream().map(Entry::from).toList();
        return new InteractionHistoryResponse(taskId, interactions.size(), interactions);
    }
}
