package com.tandem.core.wait;

import com.tandem.core.engine.InteractionService;
import com.tandem.core.engine.TaskStateMachine;
import com.tandem.core.error.ErrorKind;
import com.tandem.core.error.InteractionException;
import com.tandem.core.events.EventBus;
import com.tandem.core.events.TandemEvent;
import com.tandem.core.metrics.TandemMetrics;
import com.tandem.core.model.Actor;
import com.tandem.core.model.InteractionLogEntry;
import com.tandem.core.model.Project;
import com.tandem.core.model.Task;
import com.tandem.core.model.TaskStatus;
import com.tandem.core.security.AccessGuard;
import com.tandem.core.store.InteractionLedger;
import com.tandem.core.store.ProjectStore;
import com.tandem.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.IntFunction;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Bounded waits for new work and for human verdicts.
 * <p>
 * A wait holds no thread. It subscribes to the project's events, then evaluates its
 * condition against the stores immediately, on every relevant event, on a scheduled
 * tick every poll interval (to observe writes made by other processes), and once more
 * at expiry. Preconditions are checked once, before anything is scheduled, and fail
 * by throwing {@link InteractionException}.
 * <p>
 * Cancelling the returned future releases the subscription and the scheduled ticks.
 */
@Service
public class WaitCoordinator {

    private static final Logger log = LoggerFactory.getLogger(WaitCoordinator.class);

    /** Statuses that count as open work for {@link #waitForNewTasks}. */
    static final Set<TaskStatus> OPEN_STATUSES = EnumSet.of(TaskStatus.TODO, TaskStatus.IN_PROGRESS, TaskStatus.REVIEW);

    private final TaskStore taskStore;
    private final InteractionLedger ledger;
    private final ProjectStore projectStore;
    private final AccessGuard accessGuard;
    private final InteractionService interactionService;
    private final TaskStateMachine stateMachine;
    private final EventBus eventBus;
    private final ScheduledExecutorService scheduler;
    private final TandemMetrics metrics;
    private final Clock clock;

    public WaitCoordinator(TaskStore taskStore, InteractionLedger ledger, ProjectStore projectStore,
                           AccessGuard accessGuard, InteractionService interactionService,
                           TaskStateMachine stateMachine, EventBus eventBus,
                           ScheduledExecutorService waitScheduler, TandemMetrics metrics, Clock clock) {
        this.taskStore = taskStore;
        this.ledger = ledger;
        this.projectStore = projectStore;
        this.accessGuard = accessGuard;
        this.interactionService = interactionService;
        this.stateMachine = stateMachine;
        this.eventBus = eventBus;
        this.scheduler = waitScheduler;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Waits until the project has open tasks created after the wait started.
     *
     * @throws InteractionException NOT_FOUND (listing the caller's projects) or PERMISSION_DENIED
     */
    public CompletableFuture<NewTasksOutcome> waitForNewTasks(Actor actor, String projectName, WaitWindow window) {
        Project project = projectStore.findByName(projectName).orElseThrow(() -> {
            List<String> available = projectStore.findByOwner(actor.userId()).stream()
                    .map(Project::name)
                    .collect(Collectors.toList());
            return new InteractionException(ErrorKind.NOT_FOUND,
                    "Project '" + projectName + "' not found", Map.of("available_projects", available));
        });
        accessGuard.requireProjectOwner(actor, project);

        Instant startedAt = clock.instant();
        log.info("Waiting for new tasks in project {} (timeout={}s, interval={}s)",
                project.name(), window.timeoutSeconds(), window.pollInterval().toSeconds());

        PendingWait<NewTasksOutcome> wait = new PendingWait<>(
                "new_tasks",
                project.id(),
                event -> TandemEvent.TASK_CREATED.equals(event.eventType()),
                polls -> {
                    List<Task> found = taskStore.findCreatedAfter(project.id(), startedAt, OPEN_STATUSES);
                    log.debug("New-task check #{} for project {}: {} found", polls, project.name(), found.size());
                    if (found.isEmpty()) {
                        return Optional.empty();
                    }
                    return Optional.of(new NewTasksOutcome(project, found, polls, elapsedSince(startedAt),
                            startedAt, false, window.timeout()));
                },
                polls -> new NewTasksOutcome(project, List.of(), polls, elapsedSince(startedAt),
                        startedAt, true, window.timeout()),
                startedAt);
        return wait.start(window);
    }

    /**
     * Waits until the agent's pending completion claim is answered.
     *
     * @throws InteractionException NOT_FOUND, PERMISSION_DENIED, INVALID_STATE or SESSION_MISMATCH
     */
    public CompletableFuture<HumanFeedbackOutcome> waitForHumanFeedback(Actor actor, long taskId, String sessionId,
                                                                       WaitWindow window) {
        Task task = interactionService.requireAccessibleTask(actor, taskId);
        stateMachine.requireAwaitingVerdict(task, sessionId);

        Instant startedAt = clock.instant();
        log.info("Waiting for human feedback on task {} session {} (timeout={}s, interval={}s)",
                taskId, sessionId, window.timeoutSeconds(), window.pollInterval().toSeconds());

        PendingWait<HumanFeedbackOutcome> wait = new PendingWait<>(
                "human_feedback",
                task.projectId(),
                event -> event.taskId() == taskId,
                polls -> {
                    Task current = taskStore.findById(taskId)
                            .orElseThrow(() -> InteractionException.notFound("Task with ID " + taskId + " not found"));
                    Optional<InteractionLogEntry> fresh = ledger.findLatestHumanResponse(sessionId, startedAt);
                    log.debug("Human-feedback check #{} for task {}: waiting={}, fresh response={}",
                            polls, taskId, current.aiWaitingFeedback(), fresh.isPresent());
                    if (current.aiWaitingFeedback() && fresh.isEmpty()) {
                        return Optional.empty();
                    }
                    InteractionLogEntry latest = fresh.orElse(null);
                    return Optional.of(new HumanFeedbackOutcome(current, sessionId, true, latest, polls,
                            elapsedSince(startedAt), startedAt, false, window.timeout()));
                },
                polls -> {
                    Task current = taskStore.findById(taskId).orElse(task);
                    return new HumanFeedbackOutcome(current, sessionId, false, null, polls,
                            elapsedSince(startedAt), startedAt, true, window.timeout());
                },
                startedAt);
        return wait.start(window);
    }

    private Duration elapsedSince(Instant startedAt) {
        Duration elapsed = Duration.between(startedAt, clock.instant());
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }

    /** Condition evaluated against the stores; empty while not yet satisfied. */
    @FunctionalInterface
    private interface Check<T> {
        Optional<T> evaluate(int pollCount);
    }

    /**
     * One outstanding wait. Evaluations are serialized on the instance monitor, and the
     * first resolution wins.
     */
    private final class PendingWait<T> {

        private final String kind;
        private final long projectId;
        private final Predicate<TandemEvent> relevant;
        private final Check<T> check;
        private final IntFunction<T> onExpiry;
        private final Instant startedAt;
        private final CompletableFuture<T> future = new CompletableFuture<>();

        private int pollCount;
        private volatile EventBus.Subscription subscription;
        private volatile ScheduledFuture<?> ticks;
        private volatile ScheduledFuture<?> expiry;

        PendingWait(String kind, long projectId, Predicate<TandemEvent> relevant, Check<T> check,
                    IntFunction<T> onExpiry, Instant startedAt) {
            this.kind = kind;
            this.projectId = projectId;
            this.relevant = relevant;
            this.check = check;
            this.onExpiry = onExpiry;
            this.startedAt = startedAt;
        }

        CompletableFuture<T> start(WaitWindow window) {
            future.whenComplete((result, error) -> finish(error));

            subscription = eventBus.subscribe(projectId, event -> {
                if (!future.isDone() && relevant.test(event)) {
                    scheduler.execute(this::evaluate);
                }
            });

            evaluate();

            if (!future.isDone()) {
                long intervalMillis = window.pollInterval().toMillis();
                ticks = scheduler.scheduleAtFixedRate(this::evaluate, intervalMillis, intervalMillis,
                        TimeUnit.MILLISECONDS);
                expiry = scheduler.schedule(this::expire, window.timeout().toMillis(), TimeUnit.MILLISECONDS);
            }
            if (future.isDone()) {
                release();
            }
            return future;
        }

        private synchronized void evaluate() {
            if (future.isDone()) {
                return;
            }
            pollCount++;
            try {
                check.evaluate(pollCount).ifPresent(future::complete);
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            }
        }

        private synchronized void expire() {
            if (future.isDone()) {
                return;
            }
            evaluate();
            if (!future.isDone()) {
                try {
                    future.complete(onExpiry.apply(pollCount));
                } catch (RuntimeException e) {
                    future.completeExceptionally(e);
                }
            }
        }

        private void finish(Throwable error) {
            release();
            Duration waited = elapsedSince(startedAt);
            String outcome = outcomeOf(error);
            metrics.recordWait(kind, outcome, waited);
            if (error == null) {
                log.info("Wait {} in project {} finished: {} after {} check(s), {} ms",
                        kind, projectId, outcome, pollCount, waited.toMillis());
            } else if (error instanceof CancellationException) {
                log.info("Wait {} in project {} cancelled after {} check(s)", kind, projectId, pollCount);
            } else {
                log.warn("Wait {} in project {} failed: {}", kind, projectId, unwrap(error).getMessage());
            }
        }

        private String outcomeOf(Throwable error) {
            if (error instanceof CancellationException) {
                return "cancelled";
            }
            if (error != null) {
                return "failed";
            }
            T result = future.getNow(null);
            boolean timedOut = result instanceof NewTasksOutcome n ? n.timedOut()
                    : result instanceof HumanFeedbackOutcome h && h.timedOut();
            return timedOut ? "timeout" : "resolved";
        }

        private void release() {
            EventBus.Subscription sub = subscription;
            if (sub != null) {
                sub.unsubscribe();
            }
            cancel(ticks);
            cancel(expiry);
        }

        private void cancel(ScheduledFuture<?> scheduled) {
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
