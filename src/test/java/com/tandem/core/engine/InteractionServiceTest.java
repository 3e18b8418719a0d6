package com.tandem.core.engine;

import com.tandem.core.error.ErrorKind;
import com.tandem.core.error.InteractionException;
import com.tandem.core.events.TandemEvent;
import com.tandem.core.model.HumanVerdict;
import com.tandem.core.model.InteractionLogEntry;
import com.tandem.core.model.InteractionType;
import com.tandem.core.model.NewTask;
import com.tandem.core.model.Task;
import com.tandem.core.model.TaskStatus;
import com.tandem.core.store.TaskTransition;
import com.tandem.support.TandemFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.tandem.support.TandemFixture.CREATOR;
import static com.tandem.support.TandemFixture.OWNER;
import static com.tandem.support.TandemFixture.STRANGER;
import static org.junit.jupiter.api.Assertions.*;

class InteractionServiceTest {

    private TandemFixture fx;
    private final List<TandemEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        fx = new TandemFixture();
        fx.eventBus.subscribe(fx.project.id(), events::add);
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    private static void assertWaitingInvariant(Task task) {
        assertEquals(task.status() == TaskStatus.WAITING_HUMAN_FEEDBACK, task.aiWaitingFeedback());
        if (task.aiWaitingFeedback()) {
            assertNotNull(task.interactionSessionId());
        }
    }

    @Nested
    @DisplayName("submitFeedback")
    class SubmitFeedbackTests {

        @Test
        @DisplayName("non-interactive DONE completes directly")
        void plainTaskCompletes() {
            Task task = fx.plainTask("Refactor");

            FeedbackOutcome outcome = fx.interactions.submitFeedback(OWNER, task.id(), "alpha",
                    "refactored", TaskStatus.DONE, "agent");

            assertEquals(TaskStatus.DONE, outcome.task().status());
            assertFalse(outcome.waitingHumanFeedback());
            assertEquals(FeedbackOutcome.SUBMITTED, outcome.message());
            assertTrue(fx.ledger.findByTask(task.id()).isEmpty());
            assertEquals(1L, outcome.task().version());
        }

        @Test
        @DisplayName("interactive DONE waits for a human and writes one agent entry")
        void interactiveDoneWaits() {
            Task task = fx.interactiveTask("Write docs");

            FeedbackOutcome outcome = fx.interactions.submitFeedback(OWNER, task.id(), "alpha",
                    "docs written", TaskStatus.DONE, "agent");

            Task stored = fx.tasks.findById(task.id()).orElseThrow();
            assertEquals(TaskStatus.WAITING_HUMAN_FEEDBACK, stored.status());
            assertTrue(outcome.waitingHumanFeedback());
            assertEquals(FeedbackOutcome.AWAITING_HUMAN, outcome.message());
            assertWaitingInvariant(stored);

            List<InteractionLogEntry> history = fx.ledger.findByTask(task.id());
            assertEquals(1, history.size());
            assertEquals(InteractionType.AI_FEEDBACK, history.get(0).type());
            assertEquals(stored.interactionSessionId(), history.get(0).sessionId());
            assertNotNull(history.get(0).id());
        }

        @Test
        @DisplayName("publishes feedback_submitted after the commit")
        void publishesEvent() {
            Task task = fx.interactiveTask("Write docs");
            events.clear();

            fx.interactions.submitFeedback(OWNER, task.id(), "alpha", "done", TaskStatus.DONE, "agent");

            assertEquals(1, events.size());
            TandemEvent event = events.get(0);
            assertEquals(TandemEvent.FEEDBACK_SUBMITTED, event.eventType());
            assertEquals(task.id(), event.taskId());
            assertEquals("waiting_human_feedback", event.payload().get("status"));
            assertNotNull(event.sessionId());
        }

        @Test
        @DisplayName("unknown task is not found")
        void unknownTask() {
            var e = assertThrows(InteractionException.class, () -> fx.interactions.submitFeedback(
                    OWNER, 404L, "alpha", "x", TaskStatus.DONE, "agent"));
            assertEquals(ErrorKind.NOT_FOUND, e.kind());
        }

        @Test
        @DisplayName("unknown project is not found")
        void unknownProject() {
            Task task = fx.plainTask("Refactor");

            var e = assertThrows(InteractionException.class, () -> fx.interactions.submitFeedback(
                    OWNER, task.id(), "nowhere", "x", TaskStatus.DONE, "agent"));
            assertEquals(ErrorKind.NOT_FOUND, e.kind());
        }

        @Test
        @DisplayName("task in another project is an invalid argument")
        void wrongProject() {
            fx.projects.createIfAbsent("beta", OWNER.userId());
            Task task = fx.plainTask("Refactor");

            var e = assertThrows(InteractionException.class, () -> fx.interactions.submitFeedback(
                    OWNER, task.id(), "beta", "x", TaskStatus.DONE, "agent"));
            assertEquals(ErrorKind.INVALID_ARGUMENT, e.kind());
        }

        @Test
        @DisplayName("stranger is denied and nothing changes")
        void strangerDenied() {
            Task task = fx.interactiveTask("Write docs");

            var e = assertThrows(InteractionException.class, () -> fx.interactions.submitFeedback(
                    STRANGER, task.id(), "alpha", "x", TaskStatus.DONE, "agent"));
            assertEquals(ErrorKind.PERMISSION_DENIED, e.kind());
            assertEquals(task, fx.tasks.findById(task.id()).orElseThrow());
            assertTrue(fx.ledger.findByTask(task.id()).isEmpty());
        }

        @Test
        @DisplayName("task creator who does not own the project may report feedback")
        void creatorAllowed() {
            Task task = fx.tasks.insert(new NewTask(fx.project.id(), CREATOR.userId(), "Mine", null,
                    TaskStatus.TODO, true));

            FeedbackOutcome outcome = fx.interactions.submitFeedback(CREATOR, task.id(), "alpha",
                    "working", TaskStatus.IN_PROGRESS, "agent");

            assertEquals(TaskStatus.IN_PROGRESS, outcome.task().status());
        }

        @Test
        @DisplayName("second submission while waiting is rejected")
        void resubmitRejected() {
            Task waiting = fx.awaitingVerdict("Write docs");

            var e = assertThrows(InteractionException.class, () -> fx.interactions.submitFeedback(
                    OWNER, waiting.id(), "alpha", "again", TaskStatus.DONE, "agent"));
            assertEquals(ErrorKind.INVALID_STATE, e.kind());
            assertEquals(1, fx.ledger.findByTask(waiting.id()).size());
        }

        @Test
        @DisplayName("cancelling a waiting task clears the session")
        void cancelWhileWaiting() {
            Task waiting = fx.awaitingVerdict("Write docs");

            FeedbackOutcome outcome = fx.interactions.submitFeedback(OWNER, waiting.id(), "alpha",
                    "abandoned", TaskStatus.CANCELLED, "agent");

            assertEquals(TaskStatus.CANCELLED, outcome.task().status());
            assertNull(outcome.task().interactionSessionId());
            assertWaitingInvariant(outcome.task());
        }

        @Test
        @DisplayName("records a feedback submission metric")
        void recordsMetric() {
            Task task = fx.interactiveTask("Write docs");

            fx.interactions.submitFeedback(OWNER, task.id(), "alpha", "done", TaskStatus.DONE, "agent");

            assertEquals(1.0, fx.registry.get("tandem.feedback.submissions")
                    .tag("status", "waiting_human_feedback")
                    .tag("interactive", "true")
                    .counter().count());
        }
    }

    @Nested
    @DisplayName("submitHumanResponse")
    class HumanResponseTests {

        @Test
        @DisplayName("complete finishes the task and keeps the session")
        void completeFinishes() {
            Task waiting = fx.awaitingVerdict("Write docs");
            String session = waiting.interactionSessionId();

            HumanResponseOutcome outcome = fx.interactions.submitHumanResponse(OWNER, waiting.id(), session,
                    "approved", HumanVerdict.COMPLETE);

            assertEquals(TaskStatus.DONE, outcome.task().status());
            assertNotNull(outcome.task().completedAt());
            assertEquals(session, outcome.task().interactionSessionId());
            assertNotNull(outcome.entry().id());
            assertWaitingInvariant(outcome.task());
            assertEquals(2, fx.ledger.findByTask(waiting.id()).size());
        }

        @Test
        @DisplayName("continue reopens the task for another round on the same session")
        void continueThenResubmit() {
            Task waiting = fx.awaitingVerdict("Write docs");
            String session = waiting.interactionSessionId();

            HumanResponseOutcome outcome = fx.interactions.submitHumanResponse(OWNER, waiting.id(), session,
                    "add an example", HumanVerdict.CONTINUE);
            assertEquals(TaskStatus.IN_PROGRESS, outcome.task().status());

            FeedbackOutcome again = fx.interactions.submitFeedback(OWNER, waiting.id(), "alpha",
                    "example added", TaskStatus.DONE, "agent");
            assertEquals(session, again.task().interactionSessionId());
            assertTrue(again.waitingHumanFeedback());
            assertEquals(3, fx.ledger.findByTask(waiting.id()).size());
        }

        @Test
        @DisplayName("second verdict on the same round is rejected")
        void secondVerdictRejected() {
            Task waiting = fx.awaitingVerdict("Write docs");
            String session = waiting.interactionSessionId();
            fx.interactions.submitHumanResponse(OWNER, waiting.id(), session, "ok", HumanVerdict.COMPLETE);

            var e = assertThrows(InteractionException.class, () -> fx.interactions.submitHumanResponse(
                    OWNER, waiting.id(), session, "ok", HumanVerdict.COMPLETE));
            assertEquals(ErrorKind.INVALID_STATE, e.kind());
        }

        @Test
        @DisplayName("wrong session is rejected without writing")
        void wrongSession() {
            Task waiting = fx.awaitingVerdict("Write docs");

            var e = assertThrows(InteractionException.class, () -> fx.interactions.submitHumanResponse(
                    OWNER, waiting.id(), "bogus", "ok", HumanVerdict.COMPLETE));
            assertEquals(ErrorKind.SESSION_MISMATCH, e.kind());
            assertEquals(1, fx.ledger.findByTask(waiting.id()).size());
        }

        @Test
        @DisplayName("stranger cannot answer")
        void strangerDenied() {
            Task waiting = fx.awaitingVerdict("Write docs");

            var e = assertThrows(InteractionException.class, () -> fx.interactions.submitHumanResponse(
                    STRANGER, waiting.id(), waiting.interactionSessionId(), "ok", HumanVerdict.COMPLETE));
            assertEquals(ErrorKind.PERMISSION_DENIED, e.kind());
        }

        @Test
        @DisplayName("publishes human_responded and counts the verdict")
        void publishesAndCounts() {
            Task waiting = fx.awaitingVerdict("Write docs");
            events.clear();

            fx.interactions.submitHumanResponse(OWNER, waiting.id(), waiting.interactionSessionId(),
                    "ok", HumanVerdict.COMPLETE);

            assertEquals(TandemEvent.HUMAN_RESPONDED, events.get(0).eventType());
            assertEquals("complete", events.get(0).payload().get("action"));
            assertEquals(1.0, fx.registry.get("tandem.human.responses").tag("verdict", "complete")
                    .counter().count());
        }
    }

    @Nested
    @DisplayName("concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("stale commit is rejected as a conflict")
        void staleCommitConflicts() {
            Task waiting = fx.awaitingVerdict("Write docs");
            TaskTransition stale = fx.stateMachine.onHumanResponse(waiting, waiting.interactionSessionId(),
                    "late", HumanVerdict.CONTINUE, OWNER, fx.clock.instant());

            fx.interactions.submitHumanResponse(OWNER, waiting.id(), waiting.interactionSessionId(),
                    "first", HumanVerdict.COMPLETE);

            var e = assertThrows(InteractionException.class, () -> fx.tasks.commit(stale));
            assertEquals(ErrorKind.CONFLICT, e.kind());
            assertTrue(e.kind().isRetryable());
            assertEquals(TaskStatus.DONE, fx.tasks.findById(waiting.id()).orElseThrow().status());
            assertEquals(2, fx.ledger.findByTask(waiting.id()).size());
        }
    }

    @Nested
    @DisplayName("reads")
    class ReadTests {

        @Test
        @DisplayName("history lists entries oldest first")
        void historyOrdered() {
            Task waiting = fx.awaitingVerdict("Write docs");
            fx.interactions.submitHumanResponse(OWNER, waiting.id(), waiting.interactionSessionId(),
                    "more", HumanVerdict.CONTINUE);

            List<InteractionLogEntry> history = fx.interactions.getInteractionHistory(OWNER, waiting.id());

            assertEquals(List.of(InteractionType.AI_FEEDBACK, InteractionType.HUMAN_RESPONSE),
                    history.stream().map(InteractionLogEntry::type).toList());
        }

        @Test
        @DisplayName("status of a task the caller cannot access is denied")
        void statusDenied() {
            Task task = fx.plainTask("Refactor");

            var e = assertThrows(InteractionException.class,
                    () -> fx.interactions.getInteractionStatus(STRANGER, task.id()));
            assertEquals(ErrorKind.PERMISSION_DENIED, e.kind());
        }
    }
}
