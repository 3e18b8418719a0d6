package com.tandem.dispatch.tools;

import com.tandem.core.engine.InteractionService;
import com.tandem.core.error.StoreException;
import com.tandem.core.model.Task;
import com.tandem.core.wait.WaitProperties;
import com.tandem.dispatch.api.FeedbackResponse;
import com.tandem.dispatch.api.HumanFeedbackSubmitResponse;
import com.tandem.dispatch.api.HumanFeedbackWaitResponse;
import com.tandem.dispatch.api.InteractionHistoryResponse;
import com.tandem.dispatch.api.InteractionStatusResponse;
import com.tandem.dispatch.api.NewTasksResponse;
import com.tandem.dispatch.api.TaskResponse;
import com.tandem.support.TandemFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static com.tandem.support.TandemFixture.OWNER;
import static com.tandem.support.TandemFixture.STRANGER;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ToolDispatcherTest {

    private TandemFixture fx;
    private ToolDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        fx = new TandemFixture();
        dispatcher = new ToolDispatcher(fx.interactions, fx.intake, fx.waits, new WaitProperties(),
                new InputSanitizer());
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    private ToolResult call(String tool, Map<String, Object> args) throws Exception {
        return dispatcher.dispatch(tool, args, OWNER).get(2, TimeUnit.SECONDS);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> errorBody(ToolResult result) {
        return (Map<String, Object>) result.body();
    }

    @Test
    @DisplayName("lists every tool")
    void toolNames() {
        assertTrue(dispatcher.toolNames().containsAll(List.of("submit_task_feedback", "submit_human_feedback",
                "wait_for_new_tasks", "wait_for_human_feedback", "get_interaction_status",
                "get_interaction_history", "create_task")));
    }

    @Test
    @DisplayName("unknown tool is an invalid argument")
    void unknownTool() throws Exception {
        ToolResult result = call("drop_tables", Map.of());

        assertEquals(400, result.status());
        assertEquals("invalid_argument", errorBody(result).get("error"));
    }

    @Nested
    @DisplayName("submit_task_feedback")
    class SubmitTaskFeedbackTests {

        @Test
        @DisplayName("missing fields produce the combined message")
        void missingFields() throws Exception {
            ToolResult result = call(ToolDispatcher.SUBMIT_TASK_FEEDBACK, Map.of("task_id", 1));

            assertEquals(400, result.status());
            assertEquals("task_id, project_name, feedback_content, and status are required",
                    errorBody(result).get("message"));
        }

        @Test
        @DisplayName("invalid status lists the allowed values")
        void invalidStatus() throws Exception {
            Task task = fx.interactiveTask("Write docs");

            ToolResult result = call(ToolDispatcher.SUBMIT_TASK_FEEDBACK, Map.of("task_id", task.id(),
                    "project_name", "alpha", "feedback_content", "x", "status", "finished"));

            assertEquals(400, result.status());
            assertTrue(((String) errorBody(result).get("message")).contains("waiting_human_feedback"));
        }

        @Test
        @DisplayName("interactive done is held for a human with the default agent name")
        void interactiveDone() throws Exception {
            Task task = fx.interactiveTask("Write docs");

            ToolResult result = call(ToolDispatcher.SUBMIT_TASK_FEEDBACK, Map.of("task_id", String.valueOf(task.id()),
                    "project_name", "alpha", "feedback_content", "<b>done</b>", "status", "done"));

            assertEquals(200, result.status());
            FeedbackResponse body = (FeedbackResponse) result.body();
            assertEquals("waiting_human_feedback", body.status());
            assertEquals(Boolean.TRUE, body.waitingHumanFeedback());
            assertEquals(ToolDispatcher.DEFAULT_AI_IDENTIFIER, body.aiIdentifier());
            assertEquals("&lt;b&gt;done&lt;/b&gt;", body.feedbackContent());
            assertNotNull(body.sessionId());
        }

        @Test
        @DisplayName("permission errors map to 403")
        void permissionDenied() throws Exception {
            Task task = fx.interactiveTask("Write docs");

            ToolResult result = dispatcher.dispatch(ToolDispatcher.SUBMIT_TASK_FEEDBACK, Map.of("task_id", task.id(),
                    "project_name", "alpha", "feedback_content", "x", "status", "done"), STRANGER).get();

            assertEquals(403, result.status());
            assertEquals("permission_denied", errorBody(result).get("error"));
        }
    }

    @Nested
    @DisplayName("submit_human_feedback")
    class SubmitHumanFeedbackTests {

        @Test
        @DisplayName("records the verdict")
        void recordsVerdict() throws Exception {
            Task waiting = fx.awaitingVerdict("Write docs");

            ToolResult result = call(ToolDispatcher.SUBMIT_HUMAN_FEEDBACK, Map.of("task_id", waiting.id(),
                    "feedback_content", "great", "action", "complete", "session_id", waiting.interactionSessionId()));

            HumanFeedbackSubmitResponse body = (HumanFeedbackSubmitResponse) result.body();
            assertEquals("done", body.taskStatus());
            assertFalse(body.aiWaitingFeedback());
            assertNotNull(body.interactionLogId());
        }

        @Test
        @DisplayName("bad action is rejected")
        void badAction() throws Exception {
            Task waiting = fx.awaitingVerdict("Write docs");

            ToolResult result = call(ToolDispatcher.SUBMIT_HUMAN_FEEDBACK, Map.of("task_id", waiting.id(),
                    "feedback_content", "hm", "action", "reject", "session_id", waiting.interactionSessionId()));

            assertEquals(400, result.status());
        }

        @Test
        @DisplayName("wrong session maps to session_mismatch")
        void wrongSession() throws Exception {
            Task waiting = fx.awaitingVerdict("Write docs");

            ToolResult result = call(ToolDispatcher.SUBMIT_HUMAN_FEEDBACK, Map.of("task_id", waiting.id(),
                    "feedback_content", "ok", "action", "complete", "session_id", "nope"));

            assertEquals(409, result.status());
            assertEquals("session_mismatch", errorBody(result).get("error"));
        }
    }

    @Nested
    @DisplayName("reads and creation")
    class ReadTests {

        @Test
        @DisplayName("status and history reflect the handshake")
        void statusAndHistory() throws Exception {
            Task waiting = fx.awaitingVerdict("Write docs");

            var status = (InteractionStatusResponse) call(ToolDispatcher.GET_INTERACTION_STATUS,
                    Map.of("task_id", waiting.id())).body();
            var history = (InteractionHistoryResponse) call(ToolDispatcher.GET_INTERACTION_HISTORY,
                    Map.of("task_id", waiting.id())).body();

            assertTrue(status.aiWaitingFeedback());
            assertEquals("waiting_human_feedback", status.taskStatus());
            assertEquals(1, history.totalInteractions());
        }

        @Test
        @DisplayName("non-numeric task id is rejected")
        void badTaskId() throws Exception {
            ToolResult result = call(ToolDispatcher.GET_INTERACTION_STATUS, Map.of("task_id", "seven"));

            assertEquals("task_id must be a valid integer", errorBody(result).get("message"));
        }

        @Test
        @DisplayName("create_task creates an interactive task")
        void createTask() throws Exception {
            ToolResult result = call(ToolDispatcher.CREATE_TASK, Map.of("project_name", "alpha",
                    "title", "New work", "is_interactive", true));

            TaskResponse body = (TaskResponse) result.body();
            assertEquals("todo", body.status());
            assertTrue(body.interactive());
        }
    }

    @Nested
    @DisplayName("waits")
    class WaitTests {

        @Test
        @DisplayName("wait_for_new_tasks resolves when work arrives")
        void newTasksResolve() throws Exception {
            CompletableFuture<ToolResult> pending = dispatcher.dispatch(ToolDispatcher.WAIT_FOR_NEW_TASKS,
                    Map.of("project_name", "alpha", "timeout_seconds", 30, "poll_interval_seconds", 10), OWNER);
            assertFalse(pending.isDone());

            fx.plainTask("Incoming");

            NewTasksResponse body = (NewTasksResponse) pending.get(2, TimeUnit.SECONDS).body();
            assertEquals(1, body.totalNewTasks());
            assertFalse(body.timeout());
            assertNull(body.timeoutSeconds());
        }

        @Test
        @DisplayName("unknown project returns available projects")
        void unknownProject() throws Exception {
            ToolResult result = call(ToolDispatcher.WAIT_FOR_NEW_TASKS, Map.of("project_name", "ghost"));

            assertEquals(404, result.status());
            assertEquals(List.of("alpha"), errorBody(result).get("available_projects"));
        }

        @Test
        @DisplayName("wait_for_human_feedback reports continue instructions")
        void humanFeedbackResolves() throws Exception {
            Task waiting = fx.awaitingVerdict("Write docs");
            String session = waiting.interactionSessionId();

            CompletableFuture<ToolResult> pending = dispatcher.dispatch(ToolDispatcher.WAIT_FOR_HUMAN_FEEDBACK,
                    Map.of("task_id", waiting.id(), "session_id", session), OWNER);
            call(ToolDispatcher.SUBMIT_HUMAN_FEEDBACK, Map.of("task_id", waiting.id(),
                    "feedback_content", "add tests", "action", "continue", "session_id", session));

            HumanFeedbackWaitResponse body = (HumanFeedbackWaitResponse) pending.get(2, TimeUnit.SECONDS).body();
            assertTrue(body.humanFeedbackReceived());
            assertEquals("continue_task", body.action());
            assertEquals("add tests", body.additionalInstructions());
            assertEquals("in_progress", body.taskStatus());
        }

        @Test
        @DisplayName("cancelling the call releases the underlying wait")
        void cancelPropagates() throws Exception {
            CompletableFuture<ToolResult> pending = dispatcher.dispatch(ToolDispatcher.WAIT_FOR_NEW_TASKS,
                    Map.of("project_name", "alpha"), OWNER);
            assertEquals(1, fx.eventBus.subscriberCount(fx.project.id()));

            pending.cancel(true);

            long deadline = System.currentTimeMillis() + 2000;
            while (fx.eventBus.subscriberCount(fx.project.id()) != 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(0, fx.eventBus.subscriberCount(fx.project.id()));
        }
    }

    @Test
    @DisplayName("store failures become internal errors")
    void storeFailureIsInternal() throws Exception {
        InteractionService interactions = mock(InteractionService.class);
        when(interactions.getInteractionStatus(OWNER, 1L))
                .thenThrow(new StoreException("connection refused", new RuntimeException()));
        var failing = new ToolDispatcher(interactions, fx.intake, fx.waits, new WaitProperties(), new InputSanitizer());

        Map<String, Object> args = new HashMap<>();
        args.put("task_id", 1);
        ToolResult result = failing.dispatch(ToolDispatcher.GET_INTERACTION_STATUS, args, OWNER).get();

        assertEquals(500, result.status());
        assertEquals("internal", errorBody(result).get("error"));
    }
}
