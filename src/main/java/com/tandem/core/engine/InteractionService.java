package com.tandem.core.engine;

import com.tandem.core.error.ErrorKind;
import com.tandem.core.error.InteractionException;
import com.tandem.core.events.EventBus;
import com.tandem.core.events.TandemEvent;
import com.tandem.core.logging.MdcContext;
import com.tandem.core.metrics.TandemMetrics;
import com.tandem.core.model.Actor;
import com.tandem.core.model.HumanVerdict;
import com.tandem.core.model.InteractionLogEntry;
import com.tandem.core.model.Project;
import com.tandem.core.model.Task;
import com.tandem.core.model.TaskStatus;
import com.tandem.core.security.AccessGuard;
import com.tandem.core.store.InteractionLedger;
import com.tandem.core.store.ProjectStore;
import com.tandem.core.store.TaskStore;
import com.tandem.core.store.TaskTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for the agent/human handshake on a task.
 * <p>
 * Each write reads the task, checks access, asks the {@link TaskStateMachine} for the
 * transition and commits it atomically. Events are published only after the commit
 * succeeds, so a waiter woken by an event always finds the new state in the store.
 */
@Service
public class InteractionService {

    private static final Logger log = LoggerFactory.getLogger(InteractionService.class);

    private final TaskStore taskStore;
    private final InteractionLedger ledger;
    private final ProjectStore projectStore;
    private final AccessGuard accessGuard;
    private final TaskStateMachine stateMachine;
    private final EventBus eventBus;
    private final TandemMetrics metrics;
    private final Clock clock;

    public InteractionService(TaskStore taskStore, InteractionLedger ledger, ProjectStore projectStore,
                              AccessGuard accessGuard, TaskStateMachine stateMachine, EventBus eventBus,
                              TandemMetrics metrics, Clock clock) {
        this.taskStore = taskStore;
        this.ledger = ledger;
        this.projectStore = projectStore;
        this.accessGuard = accessGuard;
        this.stateMachine = stateMachine;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Records an agent's progress report on a task.
     *
     * @param projectName  project the agent believes the task belongs to
     * @param aiIdentifier free-form agent name stored in the ledger metadata
     */
    public FeedbackOutcome submitFeedback(Actor actor, long taskId, String projectName, String content,
                                          TaskStatus requested, String aiIdentifier) {
        MdcContext.setActor(actor.userId());
        try {
            Task task = requireTask(taskId);
            MdcContext.setTask(task.projectId(), task.id());

            Project project = projectStore.findByName(projectName)
                    .orElseThrow(() -> InteractionException.notFound("Project '" + projectName + "' not found"));
            if (project.id() != task.projectId()) {
                throw InteractionException.invalidArgument(
                        "Task " + taskId + " does not belong to project '" + projectName + "'");
            }
            accessGuard.requireTaskAccess(actor, task);

            TaskTransition committed = commit(stateMachine.onAgentFeedback(
                    task, requested, content, aiIdentifier, clock.instant()));
            Task next = committed.next();
            MdcContext.setSession(next.interactionSessionId());

            if (committed.statusChanged()) {
                log.info("Agent feedback on task {}: {} -> {} (requested {}, interactive={})",
                        taskId, task.status().wireValue(), next.status().wireValue(),
                        requested.wireValue(), next.interactive());
            } else {
                log.debug("Agent feedback on task {} kept status {} (interactive={})",
                        taskId, next.status().wireValue(), next.interactive());
            }
            metrics.recordFeedbackSubmission(next.status().wireValue(), next.interactive());

            Map<String, Object> payload = new HashMap<>();
            payload.put("status", next.status().wireValue());
            payload.put("requestedStatus", requested.wireValue());
            payload.put("aiWaitingFeedback", next.aiWaitingFeedback());
            publish(TandemEvent.FEEDBACK_SUBMITTED, committed, payload);

            return FeedbackOutcome.of(next);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Records a human verdict on a task that is waiting for one.
     */
    public HumanResponseOutcome submitHumanResponse(Actor actor, long taskId, String sessionId,
                                                    String content, HumanVerdict verdict) {
        MdcContext.setActor(actor.userId());
        MdcContext.setSession(sessionId);
        try {
            Task task = requireAccessibleTask(actor, taskId);
            MdcContext.setTask(task.projectId(), task.id());

            TaskTransition committed = commit(stateMachine.onHumanResponse(
                    task, sessionId, content, verdict, actor, clock.instant()));
            Task next = committed.next();

            log.info("Human verdict '{}' on task {} by user {}: {} -> {}",
                    verdict.wireValue(), taskId, actor.userId(),
                    task.status().wireValue(), next.status().wireValue());
            metrics.recordHumanResponse(verdict.wireValue());

            publish(TandemEvent.HUMAN_RESPONDED, committed,
                    Map.of("action", verdict.wireValue(), "status", next.status().wireValue()));

            InteractionLogEntry entry = committed.ledgerEntry()
                    .orElseThrow(() -> new IllegalStateException("human response committed without a ledger entry"));
            return new HumanResponseOutcome(next, entry, verdict);
        } finally {
            MdcContext.clear();
        }
    }

    /** Current task snapshot, for the interaction-status projection. */
    public Task getInteractionStatus(Actor actor, long taskId) {
        return requireAccessibleTask(actor, taskId);
    }

    /** Every ledger entry for the task, oldest first. */
    public List<InteractionLogEntry> getInteractionHistory(Actor actor, long taskId) {
        Task task = requireAccessibleTask(actor, taskId);
        return ledger.findByTask(task.id());
    }

    /**
     * @throws InteractionException NOT_FOUND or PERMISSION_DENIED
     */
    public Task requireAccessibleTask(Actor actor, long taskId) {
        Task task = requireTask(taskId);
        accessGuard.requireTaskAccess(actor, task);
        return task;
    }

    private Task requireTask(long taskId) {
        return taskStore.findById(taskId)
                .orElseThrow(() -> InteractionException.notFound("Task with ID " + taskId + " not found"));
    }

    private TaskTransition commit(TaskTransition transition) {
        try {
            return taskStore.commit(transition);
        } catch (InteractionException e) {
            if (e.kind() == ErrorKind.CONFLICT) {
                log.warn("Concurrent modification of task {}: {}", transition.previous().id(), e.getMessage());
                metrics.recordConflict();
            }
            throw e;
        }
    }

    private void publish(String eventType, TaskTransition committed, Map<String, Object> payload) {
        Task next = committed.next();
        eventBus.publish(new TandemEvent(eventType, next.projectId(), next.id(),
                next.interactionSessionId(), payload, committed.occurredAt()));
    }
}
