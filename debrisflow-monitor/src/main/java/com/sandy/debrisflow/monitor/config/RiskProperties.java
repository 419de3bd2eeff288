package com.sandy.debrisflow.monitor.config;

import com.sandy.debrisflow.monitor.entity.RiskLevel;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunable inputs of the risk model. None of these are correctness constants.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "risk")
public class RiskProperties {

    private IdCurve idCurve = new IdCurve();
    private Weights weights = new Weights();
    private Thresholds thresholds = new Thresholds();

    /** Soil water capacity used to normalise antecedent and event rainfall. */
    private double fieldCapacityMm = 100.0;
    /** Extra exceedance applied at full antecedent saturation. */
    private double antecedentGain = 0.4;
    private double saturationTrigger = 0.7;

    private double defaultSusceptibility = 0.5;
    private double defaultMaterialAvailability = 0.5;
    /** Trigger probability assumed for zones of runs dispatched without a rainfall event. */
    private double idleTriggerProbability = 0.05;

    /** Source areas farther than this from a location do not contribute to its assessment. */
    private double sourceAreaRadiusM = 5000.0;

    @PostConstruct
    public void validate() {
        thresholds.validate();
        weights.validate();
        if (fieldCapacityMm <= 0) {
            throw new IllegalStateException("risk.field-capacity-mm must be positive");
        }
    }

    @Getter
    @Setter
    public static class IdCurve {
        private double alpha = 14.0;
        private double beta = 0.4;
        private double minDurationHours = 1.0;
    }

    @Getter
    @Setter
    public static class Weights {
        private double trigger = 0.5;
        private double susceptibility = 0.3;
        private double material = 0.2;

        void validate() {
            if (trigger < 0 || susceptibility < 0 || material < 0) {
                throw new IllegalStateException("risk.weights must not be negative");
            }
            if (trigger + susceptibility + material <= 0) {
                throw new IllegalStateException("risk.weights must not all be zero");
            }
        }
    }

    @Getter
    @Setter
    public static class Thresholds {
        private double moderate = 0.25;
        private double high = 0.5;
        private double critical = 0.75;

        public RiskLevel classify(double riskValue) {
            return RiskLevel.classify(riskValue, moderate, high, critical);
        }

        void validate() {
            if (!(0 < moderate && moderate < high && high < critical && critical <= 1)) {
                throw new IllegalStateException(String.format(
                        "risk.thresholds must be ascending within (0,1]: moderate=%s high=%s critical=%s",
                        moderate, high, critical));
            }
        }
    }
}
