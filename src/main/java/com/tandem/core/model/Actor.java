package com.tandem.core.model;

/**
 * Authenticated caller of an operation.
 *
 * @param userId      identity used for ownership checks
 * @param displayName human-readable name, may be null
 */
public record Actor(long userId, String displayName) {

    /** Tag recorded as {@code created_by} on ledger entries written by this actor. */
    public String ledgerTag() {
        return "user_" + userId;
    }
}
