package com.tandem.core.model;

import java.util.Locale;

/**
 * Resolution carried by a ledger entry. Only meaningful for
 * {@link InteractionType#HUMAN_RESPONSE}; agent entries are written as {@code PENDING}.
 */
public enum InteractionStatus {
    PENDING,
    COMPLETED,
    CONTINUED;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
