package com.tandem.core.model;

import java.util.Locale;

/**
 * Lifecycle status of a task.
 * <p>
 * The wire form is lower snake case ({@code in_progress}, {@code waiting_human_feedback}).
 */
public enum TaskStatus {
    TODO,
    IN_PROGRESS,
    REVIEW,
    DONE,
    CANCELLED,
    WAITING_HUMAN_FEEDBACK;  // agent claimed completion, human verdict pending

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses either the wire form or the enum constant name.
     *
     * @throws IllegalArgumentException if the value names no status
     */
    public static TaskStatus fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        return TaskStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
