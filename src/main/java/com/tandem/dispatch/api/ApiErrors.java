package com.tandem.dispatch.api;

import com.tandem.core.error.InteractionException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error bodies shared by the tool and REST endpoints.
 */
public final class ApiErrors {

    public static final String INTERNAL = "internal";

    private ApiErrors() {}

    public static Map<String, Object> body(InteractionException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.kind().wireValue());
        body.put("message", e.getMessage());
        if (e.kind().isRetryable()) {
            body.put("retryable", true);
        }
        body.putAll(e.details());
        return body;
    }

    public static Map<String, Object> internal(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", INTERNAL);
        body.put("message", message);
        return body;
    }
}
