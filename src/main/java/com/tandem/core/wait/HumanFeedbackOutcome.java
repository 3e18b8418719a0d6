package com.tandem.core.wait;

import com.tandem.core.model.FeedbackAction;
import com.tandem.core.model.InteractionLogEntry;
import com.tandem.core.model.Task;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of waiting for a human verdict.
 *
 * @param task      task as re-read at resolution time
 * @param sessionId the session that was watched
 * @param received  whether the task left the waiting state or a verdict arrived
 * @param response  human response recorded during the wait, nullable
 * @param pollCount number of store evaluations performed
 * @param waited    time between the start of the wait and its resolution
 * @param startedAt instant before the first evaluation
 * @param timedOut  whether the wait expired without a verdict
 * @param timeout   the effective (clamped) timeout
 */
public record HumanFeedbackOutcome(
    Task task,
    String sessionId,
    boolean received,
    InteractionLogEntry response,
    int pollCount,
    Duration waited,
    Instant startedAt,
    boolean timedOut,
    Duration timeout
) {

    static final String TIMEOUT_MESSAGE = "Timeout waiting for human feedback. Task remains in waiting state.";

    /** Next step for the agent, or null when nothing was received or no response is on record. */
    public FeedbackAction action() {
        if (!received || response == null) {
            return null;
        }
        return FeedbackAction.of(response.status());
    }

    public String message() {
        if (timedOut) {
            return TIMEOUT_MESSAGE;
        }
        FeedbackAction action = action();
        return action == null ? null : action.message();
    }
}
