package com.tandem.core.engine;

import com.tandem.core.error.InteractionException;
import com.tandem.core.model.Actor;
import com.tandem.core.model.HumanVerdict;
import com.tandem.core.model.InteractionLogEntry;
import com.tandem.core.model.InteractionStatus;
import com.tandem.core.model.InteractionType;
import com.tandem.core.model.Task;
import com.tandem.core.model.TaskStatus;
import com.tandem.core.store.TaskTransition;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Computes task transitions for agent feedback and human verdicts.
 * <p>
 * Pure: reads nothing and writes nothing. Callers commit the returned
 * {@link TaskTransition} through the task store.
 */
@Component
public class TaskStateMachine {

    /** Statuses an agent may request when submitting feedback. */
    public static final Set<TaskStatus> SUBMITTABLE = EnumSet.of(
            TaskStatus.IN_PROGRESS,
            TaskStatus.REVIEW,
            TaskStatus.DONE,
            TaskStatus.CANCELLED,
            TaskStatus.WAITING_HUMAN_FEEDBACK);

    private final Supplier<String> sessionIds;

    public TaskStateMachine() {
        this(() -> UUID.randomUUID().toString());
    }

    TaskStateMachine(Supplier<String> sessionIds) {
        this.sessionIds = sessionIds;
    }

    /**
     * Applies an agent's progress report.
     * <ul>
     *   <li>CANCELLED is applied as-is, with no ledger entry, and drops the session.</li>
     *   <li>Non-interactive tasks take the requested status verbatim.</li>
     *   <li>Interactive tasks get a session if they have none, an {@code AI_FEEDBACK} entry,
     *       and a requested DONE is held in WAITING_HUMAN_FEEDBACK until a human confirms.</li>
     * </ul>
     *
     * @throws InteractionException INVALID_ARGUMENT for a status agents may not request,
     *                              INVALID_STATE when the task cannot take the request
     */
    public TaskTransition onAgentFeedback(Task task, TaskStatus requested, String content,
                                          String aiIdentifier, Instant now) {
        if (requested == null || !SUBMITTABLE.contains(requested)) {
            throw InteractionException.invalidArgument("Invalid status: "
                    + (requested == null ? "null" : requested.wireValue()));
        }

        if (requested == TaskStatus.CANCELLED) {
            Task next = task.withStatus(TaskStatus.CANCELLED, false)
                    .withSession(null)
                    .withFeedback(content, now);
            return new TaskTransition(task, next, null, now);
        }

        if (!task.interactive()) {
            if (requested == TaskStatus.WAITING_HUMAN_FEEDBACK) {
                throw InteractionException.invalidState(
                        "Task " + task.id() + " is not interactive and cannot wait for human feedback");
            }
            Task next = task.withStatus(requested, false).withFeedback(content, now);
            return new TaskTransition(task, next, null, now);
        }

        if (task.status() == TaskStatus.WAITING_HUMAN_FEEDBACK) {
            throw InteractionException.invalidState(
                    "Task " + task.id() + " is already waiting for human feedback");
        }

        String sessionId = task.interactionSessionId() != null
                ? task.interactionSessionId()
                : sessionIds.get();

        boolean holdForHuman = requested == TaskStatus.DONE || requested == TaskStatus.WAITING_HUMAN_FEEDBACK;
        TaskStatus target = holdForHuman ? TaskStatus.WAITING_HUMAN_FEEDBACK : requested;

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("ai_identifier", aiIdentifier);
        metadata.put("original_status", task.status().wireValue());
        metadata.put("requested_status", requested.wireValue());

        InteractionLogEntry entry = new InteractionLogEntry(null, task.id(), sessionId,
                InteractionType.AI_FEEDBACK, InteractionStatus.PENDING, content, metadata,
                now, InteractionLogEntry.AI_AUTHOR);

        Task next = task.withSession(sessionId)
                .withStatus(target, holdForHuman)
                .withFeedback(content, now);
        return new TaskTransition(task, next, entry, now);
    }

    /**
     * Applies a human verdict. COMPLETE finishes the task; CONTINUE hands it back to the
     * agent in IN_PROGRESS and keeps the session for the next round.
     *
     * @throws InteractionException INVALID_STATE or SESSION_MISMATCH, see
     *                              {@link #requireAwaitingVerdict(Task, String)}
     */
    public TaskTransition onHumanResponse(Task task, String sessionId, String content,
                                          HumanVerdict verdict, Actor actor, Instant now) {
        requireAwaitingVerdict(task, sessionId);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("action", verdict.wireValue());
        metadata.put("user_id", actor.userId());

        InteractionLogEntry entry = new InteractionLogEntry(null, task.id(), sessionId,
                InteractionType.HUMAN_RESPONSE, verdict.ledgerStatus(), content, metadata,
                now, actor.ledgerTag());

        Task next = switch (verdict) {
            case COMPLETE -> task.withStatus(TaskStatus.DONE, false).withCompletedAt(now);
            case CONTINUE -> task.withStatus(TaskStatus.IN_PROGRESS, false);
        };
        return new TaskTransition(task, next, entry, now);
    }

    /**
     * Checks that the task is interactive, waiting for a human verdict, and bound to
     * {@code sessionId}.
     *
     * @throws InteractionException INVALID_STATE or SESSION_MISMATCH
     */
    public void requireAwaitingVerdict(Task task, String sessionId) {
        if (!task.interactive()) {
            throw InteractionException.invalidState("Task " + task.id() + " is not interactive");
        }
        if (task.status() != TaskStatus.WAITING_HUMAN_FEEDBACK || !task.aiWaitingFeedback()) {
            throw InteractionException.invalidState("Task " + task.id() + " is not waiting for human feedback");
        }
        if (sessionId == null || !sessionId.equals(task.interactionSessionId())) {
            throw InteractionException.sessionMismatch("Invalid session ID");
        }
    }
}
