package com.tandem.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tandem.core.model.Task;

import java.time.Instant;

/**
 * JSON projection of a task's interaction state.
 */
public record InteractionStatusResponse(
    @JsonProperty("task_id") long taskId,
    @JsonProperty("is_interactive") boolean interactive,
    @JsonProperty("ai_waiting_feedback") boolean aiWaitingFeedback,
    @JsonProperty("interaction_session_id") String interactionSessionId,
    @JsonProperty("task_status") String taskStatus,
    @JsonProperty("feedback_content") String feedbackContent,
    @JsonProperty("feedback_at") Instant feedbackAt
) {

    public static InteractionStatusResponse from(Task task) {
        return new InteractionStatusResponse(task.id(), task.interactive(), task.aiWaitingFeedback(),
                task.interactionSessionId(), task.status().wireValue(), task.feedbackContent(), task.feedbackAt());
    }
}
