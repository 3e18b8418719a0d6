package com.tandem.support;

import com.tandem.core.engine.InteractionService;
import com.tandem.core.engine.TaskIntakeService;
import com.tandem.core.engine.TaskStateMachine;
import com.tandem.core.events.EventBus;
import com.tandem.core.metrics.TandemMetrics;
import com.tandem.core.model.Actor;
import com.tandem.core.model.Project;
import com.tandem.core.model.Task;
import com.tandem.core.model.TaskStatus;
import com.tandem.core.security.AccessGuard;
import com.tandem.core.store.InMemoryInteractionLedger;
import com.tandem.core.store.InMemoryProjectStore;
import com.tandem.core.store.InMemoryTaskStore;
import com.tandem.core.wait.WaitCoordinator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * The whole engine wired over in-memory stores, for tests that exercise real transitions.
 */
public class TandemFixture implements AutoCloseable {

    public static final Actor OWNER = new Actor(1L, "owner");
    public static final Actor CREATOR = new Actor(2L, "creator");
    public static final Actor STRANGER = new Actor(99L, "stranger");

    public final TickingClock clock = new TickingClock(Instant.parse("2026-01-01T00:00:00Z"));
    public final InMemoryProjectStore projects = new InMemoryProjectStore();
    public final InMemoryInteractionLedger ledger = new InMemoryInteractionLedger();
    public final InMemoryTaskStore tasks = new InMemoryTaskStore(ledger, projects, clock);
    public final EventBus eventBus = new EventBus();
    public final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    public final TandemMetrics metrics = new TandemMetrics(registry);
    public final AccessGuard accessGuard = new AccessGuard(projects);
    public final TaskStateMachine stateMachine = new TaskStateMachine();
    public final InteractionService interactions =
            new InteractionService(tasks, ledger, projects, accessGuard, stateMachine, eventBus, metrics, clock);
    public final TaskIntakeService intake = new TaskIntakeService(tasks, projects, accessGuard, eventBus, metrics);
    public final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2);
    public final WaitCoordinator waits = new WaitCoordinator(tasks, ledger, projects, accessGuard, interactions,
            stateMachine, eventBus, scheduler, metrics, clock);

    public final Project project = projects.createIfAbsent("alpha", OWNER.userId());

    public Task interactiveTask(String title) {
        return intake.createTask(OWNER, project.name(), title, null, TaskStatus.TODO, true);
    }

    public Task plainTask(String title) {
        return intake.createTask(OWNER, project.name(), title, null, TaskStatus.TODO, false);
    }

    /** Puts an interactive task into WAITING_HUMAN_FEEDBACK and returns the stored task. */
    public Task awaitingVerdict(String title) {
        Task task = interactiveTask(title);
        return interactions.submitFeedback(OWNER, task.id(), project.name(), "done, please check",
                TaskStatus.DONE, "test-agent").task();
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
