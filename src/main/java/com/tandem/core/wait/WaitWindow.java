package com.tandem.core.wait;

import java.time.Duration;
import java.util.Objects;

/**
 * How long a wait may last and how often it re-checks the stores.
 *
 * @param timeout      total wait before giving up
 * @param pollInterval period of the scheduled re-check between event wake-ups
 */
public record WaitWindow(Duration timeout, Duration pollInterval) {

    public WaitWindow {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(pollInterval, "pollInterval");
        if (timeout.isNegative() || timeout.isZero() || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("timeout and pollInterval must be positive");
        }
    }

    /**
     * Builds a window from caller-supplied seconds, substituting defaults for missing
     * values and clamping into the configured bounds.
     */
    public static WaitWindow clamped(Integer timeoutSeconds, Integer pollIntervalSeconds, WaitProperties properties) {
        int timeout = clamp(timeoutSeconds == null ? properties.getDefaultTimeoutSeconds() : timeoutSeconds,
                properties.getMinTimeoutSeconds(), properties.getMaxTimeoutSeconds());
        int interval = clamp(pollIntervalSeconds == null ? properties.getDefaultPollIntervalSeconds() : pollIntervalSeconds,
                properties.getMinPollIntervalSeconds(), properties.getMaxPollIntervalSeconds());
        return new WaitWindow(Duration.ofSeconds(timeout), Duration.ofSeconds(interval));
    }

    static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    public long timeoutSeconds() {
        return timeout.toSeconds();
    }
}
