package com.tandem.dispatch.api;

import com.tandem.core.model.Actor;
import com.tandem.core.security.ActorFilter;
import com.tandem.core.wait.WaitProperties;
import com.tandem.dispatch.tools.ToolDispatcher;
import com.tandem.dispatch.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.context.request.async.DeferredResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * REST adapter for agent tool calls.
 * <p>
 * Every call is answered asynchronously so that the two waits hold no servlet thread.
 * If the request times out or the client goes away, the pending wait is cancelled.
 */
@RestController
@RequestMapping("/api/v1/tools")
public class ToolController {

    private static final Logger log = LoggerFactory.getLogger(ToolController.class);

    /** Slack beyond the longest allowed wait before the servlet container gives up. */
    private static final long ASYNC_GRACE_SECONDS = 60;

    private final ToolDispatcher dispatcher;
    private final WaitProperties waitProperties;

    public ToolController(ToolDispatcher dispatcher, WaitProperties waitProperties) {
        this.dispatcher = dispatcher;
        this.waitProperties = waitProperties;
    }

    /**
     * GET /api/v1/tools — Names of the available tools.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> listTools() {
        return ResponseEntity.ok(Map.of("tools", dispatcher.toolNames()));
    }

    /**
     * POST /api/v1/tools/{tool} — Invoke a tool with a JSON argument object.
     */
    @PostMapping("/{tool}")
    public DeferredResult<ResponseEntity<Object>> callTool(
            @PathVariable String tool,
            @RequestBody(required = false) Map<String, Object> arguments,
            @RequestAttribute(ActorFilter.ACTOR_ATTRIBUTE) Actor actor) {

        long timeoutMillis = TimeUnit.SECONDS.toMillis(waitProperties.getMaxTimeoutSeconds() + ASYNC_GRACE_SECONDS);
        DeferredResult<ResponseEntity<Object>> deferred = new DeferredResult<>(timeoutMillis);

        CompletableFuture<ToolResult> pending = dispatcher.dispatch(tool, arguments, actor);

        deferred.onTimeout(() -> {
            log.warn("Tool {} for user {} exceeded the request timeout; cancelling", tool, actor.userId());
            pending.cancel(true);
            deferred.setErrorResult(ResponseEntity.status(503)
                    .body(ApiErrors.internal("Request timed out")));
        });
        deferred.onError(error -> {
            log.debug("Tool {} request ended early: {}", tool, error.getMessage());
            pending.cancel(true);
        });

        pending.whenComplete((result, error) -> {
            if (error != null) {
                if (!pending.isCancelled()) {
                    log.error("Tool {} failed", tool, error);
                    deferred.setErrorResult(ResponseEntity.status(500)
                            .body(ApiErrors.internal(error.getMessage())));
                }
                return;
            }
            deferred.setResult(ResponseEntity.status(result.status()).body(result.body()));
        });
        return deferred;
    }
}
