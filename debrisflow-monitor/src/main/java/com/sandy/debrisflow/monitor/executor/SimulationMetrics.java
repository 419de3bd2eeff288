package com.sandy.debrisflow.monitor.executor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Summary metrics of a finished model run. {@code footprintWkt} and {@code runoutProbability}
 * are optional; the executor may not provide them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimulationMetrics {
    private Double runoutAreaM2;
    private Double maxRunoutDistanceM;
    private Double affectedVolumeM3;
    private Double maxVelocityMs;
    private Double computationTimeS;
    private Double runoutProbability;
    private String footprintWkt;
}
