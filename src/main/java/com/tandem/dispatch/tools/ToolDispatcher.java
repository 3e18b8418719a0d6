package com.tandem.dispatch.tools;

import com.tandem.core.engine.FeedbackOutcome;
import com.tandem.core.engine.InteractionService;
import com.tandem.core.engine.TaskIntakeService;
import com.tandem.core.error.InteractionException;
import com.tandem.core.error.StoreException;
import com.tandem.core.model.Actor;
import com.tandem.core.model.HumanVerdict;
import com.tandem.core.model.Task;
import com.tandem.core.model.TaskStatus;
import com.tandem.core.wait.WaitCoordinator;
import com.tandem.core.wait.WaitProperties;
import com.tandem.core.wait.WaitWindow;
import com.tandem.dispatch.api.FeedbackResponse;
import com.tandem.dispatch.api.HumanFeedbackSubmitResponse;
import com.tandem.dispatch.api.HumanFeedbackWaitResponse;
import com.tandem.dispatch.api.InteractionHistoryResponse;
import com.tandem.dispatch.api.InteractionStatusResponse;
import com.tandem.dispatch.api.NewTasksResponse;
import com.tandem.dispatch.api.TaskResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * Transport-agnostic entry point for agent tool calls.
 * <p>
 * Parses and sanitises the JSON arguments, clamps wait windows, invokes the engine and
 * maps the outcome to a {@link ToolResult}. Synchronous tools return an already
 * completed future; the two waits complete when their condition resolves or expires.
 * Cancelling the returned future cancels the underlying wait.
 */
@Service
public class ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    public static final String SUBMIT_TASK_FEEDBACK = "submit_task_feedback";
    public static final String SUBMIT_HUMAN_FEEDBACK = "submit_human_feedback";
    public static final String WAIT_FOR_NEW_TASKS = "wait_for_new_tasks";
    public static final String WAIT_FOR_HUMAN_FEEDBACK = "wait_for_human_feedback";
    public static final String GET_INTERACTION_STATUS = "get_interaction_status";
    public static final String GET_INTERACTION_HISTORY = "get_interaction_history";
    public static final String CREATE_TASK = "create_task";

    static final String DEFAULT_AI_IDENTIFIER = "AI Assistant";

    private static final Set<String> TOOLS = new LinkedHashSet<>(List.of(
            SUBMIT_TASK_FEEDBACK, SUBMIT_HUMAN_FEEDBACK, WAIT_FOR_NEW_TASKS, WAIT_FOR_HUMAN_FEEDBACK,
            GET_INTERACTION_STATUS, GET_INTERACTION_HISTORY, CREATE_TASK));

    private final InteractionService interactionService;
    private final TaskIntakeService taskIntakeService;
    private final WaitCoordinator waitCoordinator;
    private final WaitProperties waitProperties;
    private final InputSanitizer sanitizer;

    public ToolDispatcher(InteractionService interactionService, TaskIntakeService taskIntakeService,
                          WaitCoordinator waitCoordinator, WaitProperties waitProperties,
                          InputSanitizer sanitizer) {
        this.interactionService = interactionService;
        this.taskIntakeService = taskIntakeService;
        this.waitCoordinator = waitCoordinator;
        this.waitProperties = waitProperties;
        this.sanitizer = sanitizer;
    }

    public Set<String> toolNames() {
        return TOOLS;
    }

    public CompletableFuture<ToolResult> dispatch(String tool, Map<String, Object> arguments, Actor actor) {
        ToolArguments args = new ToolArguments(arguments);
        try {
            return switch (tool) {
                case SUBMIT_TASK_FEEDBACK -> done(submitTaskFeedback(args, actor));
                case SUBMIT_HUMAN_FEEDBACK -> done(submitHumanFeedback(args, actor));
                case GET_INTERACTION_STATUS -> done(interactionStatus(args, actor));
                case GET_INTERACTION_HISTORY -> done(interactionHistory(args, actor));
                case CREATE_TASK -> done(createTask(args, actor));
                case WAIT_FOR_NEW_TASKS -> waitForNewTasks(args, actor);
                case WAIT_FOR_HUMAN_FEEDBACK -> waitForHumanFeedback(args, actor);
                default -> throw InteractionException.invalidArgument("Unknown tool: " + tool);
            };
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(toFailure(tool, e));
        }
    }

    private Object submitTaskFeedback(ToolArguments args, Actor actor) {
        requireAll(args, "task_id, project_name, feedback_content, and status are required",
                "task_id", "project_name", "feedback_content", "status");
        long taskId = args.requireLong("task_id");
        String projectName = sanitizer.sanitize(args.requireString("project_name"));
        String content = sanitizer.sanitize(args.requireString("feedback_content"));
        String aiIdentifier = args.has("ai_identifier")
                ? sanitizer.sanitize(args.optionalString("ai_identifier"))
                : DEFAULT_AI_IDENTIFIER;
        TaskStatus requested = parseSubmittableStatus(args.requireString("status"));

        FeedbackOutcome outcome = interactionService.submitFeedback(actor, taskId, projectName, content,
                requested, aiIdentifier);
        return FeedbackResponse.from(outcome, projectName, aiIdentifier);
    }

    private Object submitHumanFeedback(ToolArguments args, Actor actor) {
        requireAll(args, "feedback_content, action, and session_id are required",
                "task_id", "feedback_content", "action", "session_id");
        long taskId = args.requireLong("task_id");
        HumanVerdict verdict = parseVerdict(args.requireString("action"));
        String content = sanitizer.sanitize(args.requireString("feedback_content"));
        String sessionId = args.requireString("session_id").trim();

        return HumanFeedbackSubmitResponse.from(
                interactionService.submitHumanResponse(actor, taskId, sessionId, content, verdict));
    }

    private Object interactionStatus(ToolArguments args, Actor actor) {
        long taskId = args.requireLong("task_id");
        return InteractionStatusResponse.from(interactionService.getInteractionStatus(actor, taskId));
    }

    private Object interactionHistory(ToolArguments args, Actor actor) {
        long taskId = args.requireLong("task_id");
        return InteractionHistoryResponse.from(taskId, interactionService.getInteractionHistory(actor, taskId));
    }

    private Object createTask(ToolArguments args, Actor actor) {
        String projectName = sanitizer.sanitize(args.requireString("project_name"));
        String title = sanitizer.sanitize(args.requireString("title"));
        String content = sanitizer.sanitize(args.optionalString("content"));
        boolean interactive = args.optionalBoolean("is_interactive", false);
        TaskStatus status = args.has("status") ? parseStatus(args.optionalString("status")) : TaskStatus.TODO;

        Task task = taskIntakeService.createTask(actor, projectName, title, content, status, interactive);
        return TaskResponse.from(task, projectName);
    }

    private CompletableFuture<ToolResult> waitForNewTasks(ToolArguments args, Actor actor) {
        String projectName = sanitizer.sanitize(args.requireString("project_name"));
        WaitWindow window = WaitWindow.clamped(args.optionalInt("timeout_seconds"),
                args.optionalInt("poll_interval_seconds"), waitProperties);
        return adapt(WAIT_FOR_NEW_TASKS, waitCoordinator.waitForNewTasks(actor, projectName, window),
                NewTasksResponse::from);
    }

    private CompletableFuture<ToolResult> waitForHumanFeedback(ToolArguments args, Actor actor) {
        long taskId = args.requireLong("task_id");
        String sessionId = args.requireString("session_id").trim();
        WaitWindow window = WaitWindow.clamped(args.optionalInt("timeout_seconds"),
                args.optionalInt("poll_interval_seconds"), waitProperties);
        return adapt(WAIT_FOR_HUMAN_FEEDBACK, waitCoordinator.waitForHumanFeedback(actor, taskId, sessionId, window),
                HumanFeedbackWaitResponse::from);
    }

    private <T> CompletableFuture<ToolResult> adapt(String tool, CompletableFuture<T> wait,
                                                    Function<T, Object> toResponse) {
        CompletableFuture<ToolResult> result = wait.handle((outcome, error) -> error == null
                ? ToolResult.ok(toResponse.apply(outcome))
                : toFailure(tool, unwrap(error)));
        result.whenComplete((r, error) -> {
            if (error instanceof CancellationException) {
                wait.cancel(true);
            }
        });
        return result;
    }

    private ToolResult toFailure(String tool, Throwable error) {
        if (error instanceof InteractionException e) {
            log.info("Tool {} rejected: {} ({})", tool, e.getMessage(), e.kind().wireValue());
            return ToolResult.failure(e);
        }
        if (error instanceof StoreException e) {
            log.error("Tool {} failed on store access", tool, e);
            return ToolResult.internal(e.getMessage());
        }
        if (error instanceof CancellationException) {
            throw (CancellationException) error;
        }
        if (error instanceof RuntimeException e) {
            throw e;
        }
        throw new CompletionException(error);
    }

    private static void requireAll(ToolArguments args, String message, String... names) {
        for (String name : names) {
            if (!args.has(name)) {
                throw InteractionException.invalidArgument(message);
            }
        }
    }

    private static TaskStatus parseStatus(String value) {
        try {
            return TaskStatus.fromWire(value);
        } catch (IllegalArgumentException e) {
            throw InteractionException.invalidArgument("Invalid status: " + value);
        }
    }

    private static TaskStatus parseSubmittableStatus(String value) {
        try {
            return TaskStatus.fromWire(value);
        } catch (IllegalArgumentException e) {
            throw InteractionException.invalidArgument("Invalid status. Must be one of: "
                    + "in_progress, review, done, cancelled, waiting_human_feedback");
        }
    }

    private static HumanVerdict parseVerdict(String value) {
        try {
            return HumanVerdict.fromWire(value);
        } catch (IllegalArgumentException e) {
            throw InteractionException.invalidArgument("action must be \"complete\" or \"continue\"");
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private static CompletableFuture<ToolResult> done(Object body) {
        return CompletableFuture.completedFuture(ToolResult.ok(body));
    }
}
