package com.tandem.core.error;

/**
 * Machine-stable category of an {@link InteractionException}.
 */
public enum ErrorKind {
    INVALID_ARGUMENT("invalid_argument", 400),
    NOT_FOUND("not_found", 404),
    PERMISSION_DENIED("permission_denied", 403),
    INVALID_STATE("invalid_state", 409),
    SESSION_MISMATCH("session_mismatch", 409),
    CONFLICT("conflict", 409);

    private final String wireValue;
    private final int httpStatus;

    ErrorKind(String wireValue, int httpStatus) {
        this.wireValue = wireValue;
        this.httpStatus = httpStatus;
    }

    public String wireValue() {
        return wireValue;
    }

    public int httpStatus() {
        return httpStatus;
    }

    /** Only stale-version conflicts are worth retrying unchanged. */
    public boolean isRetryable() {
        return this == CONFLICT;
    }
}
