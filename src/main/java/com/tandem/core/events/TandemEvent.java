package com.tandem.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted after a task change has been committed. Waiters use it as a wake-up
 * signal and always re-read the stores before deciding.
 *
 * @param eventType event type (e.g. "task.created", "task.feedback_submitted", "task.human_responded")
 * @param projectId the project the task belongs to
 * @param taskId    the task this event relates to
 * @param sessionId interaction session, nullable
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record TandemEvent(
    String eventType,
    long projectId,
    long taskId,
    String sessionId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String TASK_CREATED = "task.created";
    public static final String FEEDBACK_SUBMITTED = "task.feedback_submitted";
    public static final String HUMAN_RESPONDED = "task.human_responded";
}
