package com.tandem.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tandem.core.model.Task;

import java.time.Instant;

/**
 * JSON view of a task, as listed by {@code wait_for_new_tasks} and {@code create_task}.
 */
public record TaskResponse(
    long id,
    @JsonProperty("project_id") long projectId,
    @JsonProperty("project_name") String projectName,
    @JsonProperty("creator_id") Long creatorId,
    String title,
    String content,
    String status,
    @JsonProperty("is_interactive") boolean interactive,
    @JsonProperty("ai_waiting_feedback") boolean aiWaitingFeedback,
    @JsonProperty("interaction_session_id") String interactionSessionId,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt,
    @JsonProperty("completed_at") Instant completedAt
) {

    public static TaskResponse from(Task task, String projectName) {
        return new TaskResponse(task.id(), task.projectId(), projectName, task.creatorId(), task.title(),
                task.content(), task.status().wireValue(), task.interactive(), task.aiWaitingFeedback(),
                task.interactionSessionId(), task.createdAt(), task.updatedAt(), task.completedAt());
    }
}
