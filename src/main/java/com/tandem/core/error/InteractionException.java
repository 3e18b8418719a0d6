package com.tandem.core.error;

import java.util.Map;

/**
 * Thrown when an interaction operation is rejected. Carries an {@link ErrorKind}
 * so transports can map it to a stable error code.
 */
public class InteractionException extends RuntimeException {

    private final ErrorKind kind;
    private final Map<String, Object> details;

    public InteractionException(ErrorKind kind, String message) {
        this(kind, message, Map.of());
    }

    public InteractionException(ErrorKind kind, String message, Map<String, Object> details) {
        super(message);
        this.kind = kind;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public ErrorKind kind() {
        return kind;
    }

    /** Extra fields a transport may echo next to the message. */
    public Map<String, Object> details() {
        return details;
    }

    public static InteractionException invalidArgument(String message) {
        return new InteractionException(ErrorKind.INVALID_ARGUMENT, message);
    }

    public static InteractionException notFound(String message) {
        return new InteractionException(ErrorKind.NOT_FOUND, message);
    }

    public static InteractionException permissionDenied(String message) {
        return new InteractionException(ErrorKind.PERMISSION_DENIED, message);
    }

    public static InteractionException invalidState(String message) {
        return new InteractionException(ErrorKind.INVALID_STATE, message);
    }

    public static InteractionException sessionMismatch(String message) {
        return new InteractionException(ErrorKind.SESSION_MISMATCH, message);
    }

    public static InteractionException conflict(String message) {
        return new InteractionException(ErrorKind.CONFLICT, message);
    }
}
