package com.sandy.debrisflow.monitor.event;

import java.time.LocalDateTime;

public record RainfallEventClosedEvent(Long eventId,
                                       Long locationId,
                                       LocalDateTime startTime,
                                       LocalDateTime endTime,
                                       double totalRainfallMm,
                                       double maxIntensityMmHr,
                                       boolean thresholdExceeded) {
}
