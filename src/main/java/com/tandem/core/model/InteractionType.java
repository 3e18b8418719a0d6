package com.tandem.core.model;

import java.util.Locale;

/**
 * Kind of event recorded in the interaction ledger.
 */
public enum InteractionType {
    AI_FEEDBACK,
    HUMAN_RESPONSE;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
