package com.sandy.debrisflow.monitor.service;

import java.time.Duration;

/** Fixed rolling windows maintained per location. */
public enum WindowSpan {
    ONE_HOUR(Duration.ofHours(1)),
    ONE_DAY(Duration.ofHours(24)),
    SEVEN_DAYS(Duration.ofDays(7));

    private final Duration duration;

    WindowSpan(Duration duration) {
        this.duration = duration;
    }

    public Duration duration() {
        return duration;
    }
}
