package com.tandem.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TandemMetricsTest {

    private SimpleMeterRegistry registry;
    private TandemMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new TandemMetrics(registry);
    }

    @Test
    void recordFeedbackSubmission() {
        metrics.recordFeedbackSubmission("done", false);
        metrics.recordFeedbackSubmission("done", false);
        metrics.recordFeedbackSubmission("waiting_human_feedback", true);

        assertEquals(2.0, registry.get("tandem.feedback.submissions")
                .tag("status", "done").tag("interactive", "false").counter().count());
        assertEquals(1.0, registry.get("tandem.feedback.submissions")
                .tag("status", "waiting_human_feedback").counter().count());
    }

    @Test
    void recordHumanResponse() {
        metrics.recordHumanResponse("continue");
        assertEquals(1.0, registry.get("tandem.human.responses").tag("verdict", "continue").counter().count());
    }

    @Test
    void recordWaitCountsAndTimes() {
        metrics.recordWait("human_feedback", "timeout", Duration.ofSeconds(30));
        metrics.recordWait("human_feedback", "resolved", Duration.ofSeconds(10));

        assertEquals(1.0, registry.get("tandem.waits")
                .tag("kind", "human_feedback").tag("outcome", "timeout").counter().count());
        var timer = registry.get("tandem.wait.duration").tag("kind", "human_feedback").timer();
        assertEquals(2, timer.count());
        assertEquals(40.0, timer.totalTime(TimeUnit.SECONDS), 0.001);
    }

    @Test
    void recordConflictAndRateLimited() {
        metrics.recordConflict();
        metrics.recordRateLimited();
        metrics.recordRateLimited();

        assertEquals(1.0, registry.get("tandem.conflicts").counter().count());
        assertEquals(2.0, registry.get("tandem.rate_limited").counter().count());
    }

    @Test
    void recordTaskCreated() {
        metrics.recordTaskCreated(true);
        assertEquals(1.0, registry.get("tandem.tasks.created").tag("interactive", "true").counter().count());
    }
}
