package com.tandem.dispatch.tools;

import com.tandem.core.error.InteractionException;
import com.tandem.dispatch.api.ApiErrors;

/**
 * Outcome of a tool call: an HTTP-style status and a JSON-serialisable body.
 *
 * @param status 200 on success, otherwise the error kind's status (500 for store failures)
 * @param body   a response record, or an error map with {@code error} and {@code message}
 */
public record ToolResult(int status, Object body) {

    public static ToolResult ok(Object body) {
        return new ToolResult(200, body);
    }

    public static ToolResult failure(InteractionException e) {
        return new ToolResult(e.kind().httpStatus(), ApiErrors.body(e));
    }

    public static ToolResult internal(String message) {
        return new ToolResult(500, ApiErrors.internal(message));
    }
}
