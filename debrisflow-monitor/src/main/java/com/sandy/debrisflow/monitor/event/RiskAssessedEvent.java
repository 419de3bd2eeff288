package com.sandy.debrisflow.monitor.event;

import com.sandy.debrisflow.monitor.entity.RiskLevel;
import com.sandy.debrisflow.monitor.service.RiskAssessment;

/**
 * Result of re-assessing a rainfall event; {@code previousLevel} is null on the first assessment.
 */
public record RiskAssessedEvent(Long eventId,
                                Long locationId,
                                boolean eventActive,
                                RiskLevel previousLevel,
                                RiskAssessment assessment) {
}
