package com.sandy.debrisflow.monitor.service;

import java.time.LocalDateTime;

/**
 * Rolling rainfall totals of one location as of a point in time.
 */
public record RainfallWindows(Long locationId,
                              LocalDateTime asOf,
                              double oneHourMm,
                              double oneDayMm,
                              double sevenDayMm) {

    public double sum(WindowSpan span) {
        return switch (span) {
            case ONE_HOUR -> oneHourMm;
            case ONE_DAY -> oneDayMm;
            case SEVEN_DAYS -> sevenDayMm;
        };
    }

    public static RainfallWindows empty(Long locationId, LocalDateTime asOf) {
        return new RainfallWindows(locationId, asOf, 0.0, 0.0, 0.0);
    }
}
