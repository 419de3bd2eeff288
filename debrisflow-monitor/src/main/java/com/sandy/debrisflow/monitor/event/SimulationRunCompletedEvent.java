package com.sandy.debrisflow.monitor.event;

import com.sandy.debrisflow.monitor.entity.RiskLevel;

public record SimulationRunCompletedEvent(Long runId, Long rainfallEventId, Long riskZoneId, RiskLevel zoneLevel) {
}
