package com.tandem.core.model;

/**
 * Next step reported to an agent whose wait for human feedback has resolved.
 */
public enum FeedbackAction {
    TASK_COMPLETED("task_completed", "Task has been marked as completed by human reviewer."),
    CONTINUE_TASK("continue_task", "Human has provided additional instructions. Continue working on the task."),
    PENDING("pending", "Human response received but status is pending.");

    private final String wireValue;
    private final String message;

    FeedbackAction(String wireValue, String message) {
        this.wireValue = wireValue;
        this.message = message;
    }

    public String wireValue() {
        return wireValue;
    }

    public String message() {
        return message;
    }

    public static FeedbackAction of(InteractionStatus status) {
        if (status == null) {
            return PENDING;
        }
        return switch (status) {
            case COMPLETED -> TASK_COMPLETED;
            case CONTINUED -> CONTINUE_TASK;
            case PENDING -> PENDING;
        };
    }
}
