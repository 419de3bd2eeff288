package com.sandy.debrisflow.monitor;

import com.sandy.debrisflow.monitor.config.RiskProperties;
import com.sandy.debrisflow.monitor.entity.RiskLevel;
import com.sandy.debrisflow.monitor.entity.SourceArea;
import com.sandy.debrisflow.monitor.service.EventConditions;
import com.sandy.debrisflow.monitor.service.RiskAssessment;
import com.sandy.debrisflow.monitor.service.RiskEvaluator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RiskEvaluatorTest {

    RiskProperties properties;
    RiskEvaluator evaluator;

    @BeforeEach
    void setup() {
        properties = new RiskProperties();
        properties.validate();
        evaluator = new RiskEvaluator(properties);
    }

    private static SourceArea area(Double susceptibility, Double material) {
        return SourceArea.builder().id(7L).susceptibility(susceptibility).materialAvailability(material).build();
    }

    @Test
    void eventOnTheThresholdCurveHasEvenTriggerProbability() {
        // alpha=14, beta=0.4: at one hour the curve sits at 14 mm/h
        RiskAssessment a = evaluator.evaluate(new EventConditions(14.0, 1.0, 14.0, 0.0, false), area(1.0, 1.0));
        assertEquals(1.0, a.exceedanceRatio(), 1e-9);
        assertEquals(0.5, a.triggerProbability(), 1e-9);
        assertTrue(a.thresholdExceeded());
        assertEquals(Math.sqrt(0.5), a.riskValue(), 1e-9);
        assertEquals(RiskLevel.HIGH, a.riskLevel());
        assertFalse(a.degraded());
        assertEquals(7L, a.sourceAreaId());
    }

    @Test
    void longerEventsNeedLessIntensity() {
        double curveAtFourHours = 14.0 * Math.pow(4.0, -0.4);
        RiskAssessment a = evaluator.evaluate(new EventConditions(curveAtFourHours, 4.0, 30.0, 0.0, false), area(1.0, 1.0));
        assertEquals(1.0, a.exceedanceRatio(), 1e-9);
    }

    @Test
    void antecedentRainRaisesTriggerProbability() {
        RiskAssessment dry = evaluator.evaluate(new EventConditions(8.0, 2.0, 10.0, 0.0, false), area(0.6, 0.6));
        RiskAssessment wet = evaluator.evaluate(new EventConditions(8.0, 2.0, 10.0, 80.0, false), area(0.6, 0.6));
        assertTrue(wet.triggerProbability() > dry.triggerProbability());
        assertTrue(wet.riskValue() >= dry.riskValue());
        assertTrue(wet.saturation() > dry.saturation());
    }

    @Test
    void missingSourceAreaInputsDegradeInsteadOfFailing() {
        RiskAssessment a = evaluator.evaluate(new EventConditions(14.0, 1.0, 14.0, 0.0, false), area(null, null));
        assertTrue(a.degraded());
        assertEquals(2, a.degradedReasons().size());
        // 0.5^0.5 * 0.5^0.3 * 0.5^0.2
        assertEquals(0.5, a.riskValue(), 1e-9);

        RiskAssessment none = evaluator.evaluate(new EventConditions(14.0, 1.0, 14.0, 0.0, false), null);
        assertTrue(none.degraded());
        assertNull(none.sourceAreaId());
    }

    @Test
    void riskValueStaysInUnitIntervalForExtremeInputs() {
        RiskAssessment huge = evaluator.evaluate(new EventConditions(1e6, 0.0, 1e6, 1e6, true), area(1.0, 1.0));
        assertTrue(huge.riskValue() >= 0.0 && huge.riskValue() <= 1.0);
        assertEquals(RiskLevel.CRITICAL, huge.riskLevel());
        assertEquals(1.0, huge.saturation(), 1e-9);

        RiskAssessment dry = evaluator.evaluate(new EventConditions(0.0, 0.0, 0.0, 0.0, false), area(1.0, 1.0));
        assertEquals(0.0, dry.riskValue(), 1e-9);
        assertEquals(RiskLevel.LOW, dry.riskLevel());
        assertFalse(dry.simulationRecommended());
    }

    @Test
    void levelIsMonotonicInRiskValue() {
        RiskLevel previous = RiskLevel.LOW;
        for (int i = 0; i <= 100; i++) {
            RiskLevel level = properties.getThresholds().classify(i / 100.0);
            assertTrue(level.compareTo(previous) >= 0, "level dropped at " + i);
            previous = level;
        }
        assertEquals(RiskLevel.LOW, properties.getThresholds().classify(0.249));
        assertEquals(RiskLevel.MODERATE, properties.getThresholds().classify(0.25));
        assertEquals(RiskLevel.HIGH, properties.getThresholds().classify(0.5));
        assertEquals(RiskLevel.CRITICAL, properties.getThresholds().classify(0.75));
    }

    @Test
    void thresholdsMustAscend() {
        properties.getThresholds().setModerate(0.6);
        assertThrows(IllegalStateException.class, () -> properties.validate());
    }

    @Test
    void saturatedGroundRecommendsSimulation() {
        RiskAssessment a = evaluator.evaluate(new EventConditions(2.0, 3.0, 30.0, 50.0, false), area(0.2, 0.2));
        assertEquals(0.8, a.saturation(), 1e-9);
        assertTrue(a.simulationRecommended());
        assertTrue(a.reasons().stream().anyMatch(r -> r.contains("saturation")));
    }

    @Test
    void runoutProbabilityScalesZoneRisk() {
        RiskAssessment base = evaluator.evaluate(new EventConditions(14.0, 1.0, 14.0, 0.0, false), area(1.0, 1.0));
        RiskAssessment zone = evaluator.scale(base, 0.5);
        assertEquals(base.riskValue() * 0.5, zone.riskValue(), 1e-9);
        assertEquals(RiskLevel.MODERATE, zone.riskLevel());
    }
}
