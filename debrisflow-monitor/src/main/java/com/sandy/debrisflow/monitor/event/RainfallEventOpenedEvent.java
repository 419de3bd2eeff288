package com.sandy.debrisflow.monitor.event;

import java.time.LocalDateTime;

public record RainfallEventOpenedEvent(Long eventId, Long locationId, LocalDateTime startTime) {
}
