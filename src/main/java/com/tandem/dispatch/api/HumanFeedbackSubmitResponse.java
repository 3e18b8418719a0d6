package com.tandem.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tandem.core.engine.HumanResponseOutcome;
import com.tandem.core.model.Task;

import java.time.Instant;

/**
 * JSON response for a recorded human verdict.
 */
public record HumanFeedbackSubmitResponse(
    @JsonProperty("task_id") long taskId,
    @JsonProperty("session_id") String sessionId,
    String action,
    @JsonProperty("feedback_content") String feedbackContent,
    @JsonProperty("task_status") String taskStatus,
    @JsonProperty("ai_waiting_feedback") boolean aiWaitingFeedback,
    @JsonProperty("interaction_log_id") Long interactionLogId,
    Instant timestamp
) {

    public static HumanFeedbackSubmitResponse from(HumanResponseOutcome outcome) {
        Task task = outcome.task();
        return new HumanFeedbackSubmitResponse(task.id(), outcome.entry().sessionId(),
                outcome.verdict().wireValue(), outcome.entry().content(), task.status().wireValue(),
                task.aiWaitingFeedback(), outcome.entry().id(), outcome.entry().createdAt());
    }
}
