package com.tandem.dispatch.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-key sliding-window request limiter.
 * <p>
 * Each key keeps the timestamps of its requests inside the current window. Keys whose
 * window has emptied are dropped by {@link #evictExpired()}, which the owner calls
 * periodically.
 */
public class SlidingWindowRateLimiter {

    private final int maxRequests;
    private final Duration window;
    private final Clock clock;
    private final ConcurrentHashMap<String, Deque<Instant>> requests = new ConcurrentHashMap<>();

    public SlidingWindowRateLimiter(int maxRequests, Duration window, Clock clock) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be at least 1");
        }
        this.maxRequests = maxRequests;
        this.window = window;
        this.clock = clock;
    }

    /**
     * Records a request for {@code key} if the key is under its limit.
     *
     * @return true when the request is allowed
     */
    public boolean tryAcquire(String key) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(window);
        boolean[] allowed = new boolean[1];
        requests.compute(key, (k, timestamps) -> {
            Deque<Instant> deque = timestamps == null ? new ArrayDeque<>() : timestamps;
            prune(deque, cutoff);
            if (deque.size() < maxRequests) {
                deque.addLast(now);
                allowed[0] = true;
            }
            return deque;
        });
        return allowed[0];
    }

    /**
     * Drops keys with no request inside the current window.
     *
     * @return number of keys removed
     */
    public int evictExpired() {
        Instant cutoff = clock.instant().minus(window);
        int removed = 0;
        for (String key : requests.keySet()) {
            Deque<Instant> remaining = requests.computeIfPresent(key, (k, deque) -> {
                prune(deque, cutoff);
                return deque.isEmpty() ? null : deque;
            });
            if (remaining == null) {
                removed++;
            }
        }
        return removed;
    }

    public int trackedKeys() {
        return requests.size();
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public Duration getWindow() {
        return window;
    }

    private static void prune(Deque<Instant> deque, Instant cutoff) {
        while (!deque.isEmpty() && !deque.peekFirst().isAfter(cutoff)) {
            deque.pollFirst();
        }
    }
}
