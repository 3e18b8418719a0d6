package com.tandem.core.engine;

import com.tandem.core.model.Task;

/**
 * Result of an agent feedback submission.
 *
 * @param task    task as committed
 * @param message human-readable summary for the agent
 */
public record FeedbackOutcome(Task task, String message) {

    static final String SUBMITTED = "Task feedback submitted successfully.";
    static final String AWAITING_HUMAN =
            "Task feedback submitted. Waiting for human confirmation or additional instructions.";

    public static FeedbackOutcome of(Task task) {
        return new FeedbackOutcome(task, task.aiWaitingFeedback() ? AWAITING_HUMAN : SUBMITTED);
    }

    public boolean waitingHumanFeedback() {
        return task.aiWaitingFeedback();
    }
}
