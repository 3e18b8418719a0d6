package com.tandem.dispatch.api;

import com.tandem.core.engine.InteractionService;
import com.tandem.core.error.InteractionException;
import com.tandem.core.error.StoreException;
import com.tandem.core.model.Actor;
import com.tandem.core.model.HumanVerdict;
import com.tandem.core.security.ActorFilter;
import com.tandem.dispatch.tools.InputSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.function.Supplier;

/**
 * REST controller for the human side of the handshake: answering a completion claim
 * and inspecting a task's interaction state and history.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskInteractionController {

    private static final Logger log = LoggerFactory.getLogger(TaskInteractionController.class);

    private final InteractionService interactionService;
    private final InputSanitizer sanitizer;

    public TaskInteractionController(InteractionService interactionService, InputSanitizer sanitizer) {
        this.interactionService = interactionService;
        this.sanitizer = sanitizer;
    }

    /**
     * POST /api/v1/tasks/{id}/human-feedback — Confirm completion or send the agent back to work.
     */
    @PostMapping("/{taskId}/human-feedback")
    public ResponseEntity<Object> submitHumanFeedback(
            @PathVariable long taskId,
            @RequestBody(required = false) HumanFeedbackRequest request,
            @RequestAttribute(ActorFilter.ACTOR_ATTRIBUTE) Actor actor) {

        if (request == null || isBlank(request.feedbackContent()) || isBlank(request.action())
                || isBlank(request.sessionId())) {
            return ResponseEntity.badRequest().body(ApiErrors.body(InteractionException.invalidArgument(
                    "feedback_content, action, and session_id are required")));
        }
        HumanVerdict verdict;
        try {
            verdict = HumanVerdict.fromWire(request.action());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(ApiErrors.body(InteractionException.invalidArgument(
                    "action must be \"complete\" or \"continue\"")));
        }

        String content = sanitizer.sanitize(request.feedbackContent());
        return respond(() -> HumanFeedbackSubmitResponse.from(interactionService.submitHumanResponse(
                actor, taskId, request.sessionId().trim(), content, verdict)));
    }

    /**
     * GET /api/v1/tasks/{id}/interaction-status
     */
    @GetMapping("/{taskId}/interaction-status")
    public ResponseEntity<Object> interactionStatus(
            @PathVariable long taskId,
            @RequestAttribute(ActorFilter.ACTOR_ATTRIBUTE) Actor actor) {
        return respond(() -> InteractionStatusResponse.from(interactionService.getInteractionStatus(actor, taskId)));
    }

    /**
     * GET /api/v1/tasks/{id}/interaction-history
     */
    @GetMapping("/{taskId}/interaction-history")
    public ResponseEntity<Object> interactionHistory(
            @PathVariable long taskId,
            @RequestAttribute(ActorFilter.ACTOR_ATTRIBUTE) Actor actor) {
        return respond(() -> InteractionHistoryResponse.from(taskId,
                interactionService.getInteractionHistory(actor, taskId)));
    }

    private ResponseEntity<Object> respond(Supplier<Object> action) {
        try {
            return ResponseEntity.ok(action.get());
        } catch (InteractionException e) {
            Map<String, Object> body = ApiErrors.body(e);
            return ResponseEntity.status(e.kind().httpStatus()).body(body);
        } catch (StoreException e) {
            log.error("Store failure while handling task interaction request", e);
            return ResponseEntity.status(500).body(ApiErrors.internal(e.getMessage()));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
