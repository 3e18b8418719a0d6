package com.tandem.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tandem.core.engine.FeedbackOutcome;
import com.tandem.core.model.Task;

import java.time.Instant;

/**
 * JSON response for {@code submit_task_feedback}. The waiting flag is present only
 * when the task is now held for a human verdict.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FeedbackResponse(
    @JsonProperty("task_id") long taskId,
    @JsonProperty("project_name") String projectName,
    String status,
    @JsonProperty("feedback_submitted") boolean feedbackSubmitted,
    @JsonProperty("feedback_content") String feedbackContent,
    @JsonProperty("ai_identifier") String aiIdentifier,
    Instant timestamp,
    @JsonProperty("is_interactive") boolean interactive,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("waiting_human_feedback") Boolean waitingHumanFeedback,
    String message
) {

    public static FeedbackResponse from(FeedbackOutcome outcome, String projectName, String aiIdentifier) {
        Task task = outcome.task();
        return new FeedbackResponse(task.id(), projectName, task.status().wireValue(), true,
                task.feedbackContent(), aiIdentifier, task.updatedAt(), task.interactive(),
                task.interactionSessionId(), outcome.waitingHumanFeedback() ? Boolean.TRUE : null,
                outcome.message());
    }
}
