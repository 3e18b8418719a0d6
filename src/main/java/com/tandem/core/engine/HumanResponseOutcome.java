package com.tandem.core.engine;

import com.tandem.core.model.HumanVerdict;
import com.tandem.core.model.InteractionLogEntry;
import com.tandem.core.model.Task;

/**
 * Result of a human verdict.
 *
 * @param task    task as committed
 * @param entry   the appended {@code HUMAN_RESPONSE} ledger entry, with its id
 * @param verdict the verdict that was applied
 */
public record HumanResponseOutcome(Task task, InteractionLogEntry entry, HumanVerdict verdict) {
}
