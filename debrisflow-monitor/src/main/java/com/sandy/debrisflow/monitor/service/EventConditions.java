package com.sandy.debrisflow.monitor.service;

import com.sandy.debrisflow.monitor.entity.RainfallEvent;

/**
 * Rainfall inputs of one risk evaluation.
 *
 * @param maxIntensityMmHr   peak intensity observed during the event
 * @param durationHours      elapsed event duration
 * @param eventRainfallMm    rainfall accumulated by the event
 * @param antecedentMm       7-day rainfall that fell before the event
 * @param thresholdExceeded  whether the detector already flagged the event
 */
public record EventConditions(double maxIntensityMmHr,
                              double durationHours,
                              double eventRainfallMm,
                              double antecedentMm,
                              boolean thresholdExceeded) {

    public static EventConditions of(RainfallEvent event, RainfallWindows windows) {
        return of(event, windows.sevenDayMm());
    }

    /**
     * Antecedent rainfall is the 7-day total at the event's latest observation minus the event's own rainfall.
     */
    public static EventConditions of(RainfallEvent event, double sevenDayMm) {
        double antecedent = Math.max(0.0, sevenDayMm - event.getTotalRainfallMm());
        return new EventConditions(event.getMaxIntensityMmHr(), event.elapsedHours(),
                event.getTotalRainfallMm(), antecedent, event.isThresholdExceeded());
    }
}
