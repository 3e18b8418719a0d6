package com.tandem.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/tasks/{id}/human-feedback.
 *
 * @param feedbackContent reviewer's verdict text or additional instructions
 * @param action          {@code complete} or {@code continue}
 * @param sessionId       session the verdict answers
 */
public record HumanFeedbackRequest(
    @JsonProperty("feedback_content") String feedbackContent,
    String action,
    @JsonProperty("session_id") String sessionId
) {}
