package com.sandy.debrisflow.monitor.event;

import com.sandy.debrisflow.monitor.entity.FailureCause;

public record SimulationRunFailedEvent(Long runId, Long rainfallEventId, FailureCause cause, String errorMessage) {
}
