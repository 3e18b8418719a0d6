package com.tandem.core.model;

import java.util.Locale;

/**
 * A human reviewer's answer to a completion claim.
 */
public enum HumanVerdict {
    COMPLETE(InteractionStatus.COMPLETED),
    CONTINUE(InteractionStatus.CONTINUED);

    private final InteractionStatus ledgerStatus;

    HumanVerdict(InteractionStatus ledgerStatus) {
        this.ledgerStatus = ledgerStatus;
    }

    public InteractionStatus ledgerStatus() {
        return ledgerStatus;
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException if the value is neither "complete" nor "continue"
     */
    public static HumanVerdict fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("action must not be null");
        }
        return HumanVerdict.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
