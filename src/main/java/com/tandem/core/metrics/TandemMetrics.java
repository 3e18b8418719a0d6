package com.tandem.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for agent/human interactions.
 */
@Service
public class TandemMetrics {

    private final MeterRegistry registry;

    public TandemMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordFeedbackSubmission(String resultingStatus, boolean interactive) {
        Counter.builder("tandem.feedback.submissions")
                .tag("status", resultingStatus)
                .tag("interactive", String.valueOf(interactive))
                .register(registry)
                .increment();
    }

    public void recordHumanResponse(String verdict) {
        Counter.builder("tandem.human.responses")
                .tag("verdict", verdict)
                .register(registry)
                .increment();
    }

    public void recordTaskCreated(boolean interactive) {
        Counter.builder("tandem.tasks.created")
                .tag("interactive", String.valueOf(interactive))
                .register(registry)
                .increment();
    }

    /**
     * Records the end of a wait.
     *
     * @param kind    "new_tasks" or "human_feedback"
     * @param outcome "resolved", "timeout", "cancelled" or "failed"
     * @param waited  wall-clock time the waiter was pending
     */
    public void recordWait(String kind, String outcome, Duration waited) {
        Counter.builder("tandem.waits")
                .description("Completed long-poll waits by outcome")
                .tag("kind", kind)
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        Timer.builder("tandem.wait.duration")
                .tag("kind", kind)
                .register(registry)
                .record(waited);
    }

    /**
     * Records a stale-version rejection on commit.
     */
    public void recordConflict() {
        Counter.builder("tandem.conflicts")
                .description("Task commits rejected because of a concurrent modification")
                .register(registry)
                .increment();
    }

    public void recordRateLimited() {
        Counter.builder("tandem.rate_limited")
                .register(registry)
                .increment();
    }
}
