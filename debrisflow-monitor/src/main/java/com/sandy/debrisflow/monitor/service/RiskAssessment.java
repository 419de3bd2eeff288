package com.sandy.debrisflow.monitor.service;

import com.sandy.debrisflow.monitor.entity.RiskLevel;

import java.util.List;

/**
 * Output of {@link RiskEvaluator}. A degraded assessment used configured defaults for missing
 * source-area inputs; {@code degradedReasons} says which.
 */
public record RiskAssessment(double triggerProbability,
                             double exceedanceRatio,
                             double saturation,
                             double riskValue,
                             RiskLevel riskLevel,
                             boolean thresholdExceeded,
                             boolean degraded,
                             List<String> degradedReasons,
                             Long sourceAreaId,
                             boolean simulationRecommended,
                             List<String> reasons) {
}
