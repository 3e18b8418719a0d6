package com.tandem.core.wait;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Bounds and defaults for long-poll waits. Requested values outside the bounds are
 * clamped, never rejected.
 */
@Component
@ConfigurationProperties(prefix = "tandem.wait")
public class WaitProperties {

    private int defaultTimeoutSeconds = 3600;
    private int minTimeoutSeconds = 30;
    private int maxTimeoutSeconds = 7200;

    private int defaultPollIntervalSeconds = 30;
    private int minPollIntervalSeconds = 10;
    private int maxPollIntervalSeconds = 300;

    private int schedulerThreads = 2;

    public int getDefaultTimeoutSeconds() {
        return defaultTimeoutSeconds;
    }

    public void setDefaultTimeoutSeconds(int defaultTimeoutSeconds) {
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
    }

    public int getMinTimeoutSeconds() {
        return minTimeoutSeconds;
    }

    public void setMinTimeoutSeconds(int minTimeoutSeconds) {
        this.minTimeoutSeconds = minTimeoutSeconds;
    }

    public int getMaxTimeoutSeconds() {
        return maxTimeoutSeconds;
    }

    public void setMaxTimeoutSeconds(int maxTimeoutSeconds) {
        this.maxTimeoutSeconds = maxTimeoutSeconds;
    }

    public int getDefaultPollIntervalSeconds() {
        return defaultPollIntervalSeconds;
    }

    public void setDefaultPollIntervalSeconds(int defaultPollIntervalSeconds) {
        this.defaultPollIntervalSeconds = defaultPollIntervalSeconds;
    }

    public int getMinPollIntervalSeconds() {
        return minPollIntervalSeconds;
    }

    public void setMinPollIntervalSeconds(int minPollIntervalSeconds) {
        this.minPollIntervalSeconds = minPollIntervalSeconds;
    }

    public int getMaxPollIntervalSeconds() {
        return maxPollIntervalSeconds;
    }

    public void setMaxPollIntervalSeconds(int maxPollIntervalSeconds) {
        this.maxPollIntervalSeconds = maxPollIntervalSeconds;
    }

    public int getSchedulerThreads() {
        return schedulerThreads;
    }

    public void setSchedulerThreads(int schedulerThreads) {
        this.schedulerThreads = schedulerThreads;
    }
}
