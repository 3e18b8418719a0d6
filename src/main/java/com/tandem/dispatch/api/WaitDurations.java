package com.tandem.dispatch.api;

import java.time.Duration;

final class WaitDurations {

    private WaitDurations() {}

    /** Seconds rounded to two decimals. */
    static double seconds(Duration duration) {
        return Math.round(duration.toMillis() / 10.0) / 100.0;
    }
}
