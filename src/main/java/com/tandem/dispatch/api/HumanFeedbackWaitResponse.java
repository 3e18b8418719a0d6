package com.tandem.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tandem.core.model.FeedbackAction;
import com.tandem.core.model.InteractionLogEntry;
import com.tandem.core.wait.HumanFeedbackOutcome;

import java.time.Instant;

/**
 * JSON response for {@code wait_for_human_feedback}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HumanFeedbackWaitResponse(
    @JsonProperty("task_id") long taskId,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("human_feedback_received") boolean humanFeedbackReceived,
    @JsonProperty("poll_count") int pollCount,
    @JsonProperty("wait_duration_seconds") double waitDurationSeconds,
    boolean timeout,
    @JsonProperty("timeout_seconds") Long timeoutSeconds,
    @JsonProperty("task_status") String taskStatus,
    @JsonProperty("ai_waiting_feedback") boolean aiWaitingFeedback,
    @JsonProperty("human_response") HumanResponseView humanResponse,
    String action,
    String message,
    @JsonProperty("additional_instructions") String additionalInstructions
) {

    /**
     * The latest human response in the session.
     */
    public record HumanResponseView(
        String content,
        String status,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("created_by") String createdBy
    ) {
        static HumanResponseView from(InteractionLogEntry entry) {
            return new HumanResponseView(entry.content(), entry.status().wireValue(),
                    entry.createdAt(), entry.createdBy());
        }
    }

    public static HumanFeedbackWaitResponse from(HumanFeedbackOutcome outcome) {
        FeedbackAction action = outcome.action();
        InteractionLogEntry response = outcome.response();
        return new HumanFeedbackWaitResponse(
                outcome.task().id(),
                outcome.sessionId(),
                outcome.received(),
                outcome.pollCount(),
                WaitDurations.seconds(outcome.waited()),
                outcome.timedOut(),
                outcome.timedOut() ? outcome.timeout().toSeconds() : null,
                outcome.task().status().wireValue(),
                outcome.task().aiWaitingFeedback(),
                response == null ? null : HumanResponseView.from(response),
                action == null ? null : action.wireValue(),
                outcome.message(),
                action == FeedbackAction.CONTINUE_TASK ? response.content() : null);
    }
}
