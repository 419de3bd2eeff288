package com.sandy.debrisflow.monitor.service;

import com.sandy.debrisflow.monitor.config.RiskProperties;
import com.sandy.debrisflow.monitor.entity.RiskLevel;
import com.sandy.debrisflow.monitor.entity.SourceArea;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Side-effect free risk model.
 * <p>
 * Trigger probability follows an intensity-duration threshold curve {@code I = alpha * D^-beta},
 * raised by antecedent moisture: {@code p = 1 - 2^-(Imax / I * (1 + gain * min(ante / fc, 1)))},
 * so an event sitting exactly on the curve with dry antecedents gives 0.5. The composite risk is the
 * weighted product {@code p^wT * susceptibility^wS * material^wM}, clamped to [0,1].
 */
@Component
@RequiredArgsConstructor
public class RiskEvaluator {

    private final RiskProperties properties;

    public RiskAssessment evaluate(EventConditions conditions, SourceArea sourceArea) {
        RiskProperties.IdCurve curve = properties.getIdCurve();
        double durationHours = Math.max(conditions.durationHours(), curve.getMinDurationHours());
        double thresholdIntensity = curve.getAlpha() * Math.pow(durationHours, -curve.getBeta());
        double antecedent = Math.max(0.0, conditions.antecedentMm());
        double fieldCapacity = properties.getFieldCapacityMm();
        double moisture = 1.0 + properties.getAntecedentGain() * Math.min(antecedent / fieldCapacity, 1.0);
        double exceedance = Math.max(0.0, conditions.maxIntensityMmHr()) / thresholdIntensity * moisture;
        double triggerProbability = 1.0 - Math.pow(2.0, -exceedance);
        double saturation = Math.min((Math.max(0.0, conditions.eventRainfallMm()) + antecedent) / fieldCapacity, 1.0);
        boolean thresholdExceeded = conditions.thresholdExceeded() || exceedance >= 1.0;
        return combine(triggerProbability, exceedance, saturation, thresholdExceeded, sourceArea);
    }

    /**
     * Evaluates with a fixed trigger probability, used when no rainfall event drives the assessment.
     */
    public RiskAssessment evaluate(double triggerProbability, SourceArea sourceArea) {
        return combine(clamp(triggerProbability), 0.0, 0.0, false, sourceArea);
    }

    /**
     * Scales an assessment by the probability that the flow actually reaches the zone.
     */
    public RiskAssessment scale(RiskAssessment base, double runoutProbability) {
        double value = clamp(base.riskValue() * clamp(runoutProbability));
        RiskLevel level = properties.getThresholds().classify(value);
        return new RiskAssessment(base.triggerProbability(), base.exceedanceRatio(), base.saturation(), value, level,
                base.thresholdExceeded(), base.degraded(), base.degradedReasons(), base.sourceAreaId(),
                base.simulationRecommended(), base.reasons());
    }

    private RiskAssessment combine(double triggerProbability, double exceedance, double saturation,
                                   boolean thresholdExceeded, SourceArea sourceArea) {
        List<String> degradedReasons = new ArrayList<>();
        double susceptibility;
        double material;
        if (sourceArea == null) {
            degradedReasons.add("no source area in range");
            susceptibility = properties.getDefaultSusceptibility();
            material = properties.getDefaultMaterialAvailability();
        } else {
            if (sourceArea.getSusceptibility() == null) {
                degradedReasons.add("source area " + sourceArea.getId() + " has no susceptibility");
                susceptibility = properties.getDefaultSusceptibility();
            } else {
                susceptibility = sourceArea.getSusceptibility();
            }
            if (sourceArea.getMaterialAvailability() == null) {
                degradedReasons.add("source area " + sourceArea.getId() + " has no material availability");
                material = properties.getDefaultMaterialAvailability();
            } else {
                material = sourceArea.getMaterialAvailability();
            }
        }

        RiskProperties.Weights w = properties.getWeights();
        double raw = Math.pow(clamp(triggerProbability), w.getTrigger())
                * Math.pow(clamp(susceptibility), w.getSusceptibility())
                * Math.pow(clamp(material), w.getMaterial());
        double riskValue = clamp(raw);
        RiskLevel level = properties.getThresholds().classify(riskValue);

        List<String> reasons = new ArrayList<>();
        if (level.compareTo(RiskLevel.HIGH) >= 0) {
            reasons.add("risk level " + level);
        }
        if (exceedance >= 1.0) {
            reasons.add(String.format("intensity-duration threshold exceeded (ratio %.2f)", exceedance));
        }
        if (saturation >= properties.getSaturationTrigger()) {
            reasons.add(String.format("soil saturation %.2f", saturation));
        }
        return new RiskAssessment(triggerProbability, exceedance, saturation, riskValue, level, thresholdExceeded,
                !degradedReasons.isEmpty(), List.copyOf(degradedReasons),
                sourceArea != null ? sourceArea.getId() : null,
                !reasons.isEmpty(), List.copyOf(reasons));
    }

    static double clamp(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
