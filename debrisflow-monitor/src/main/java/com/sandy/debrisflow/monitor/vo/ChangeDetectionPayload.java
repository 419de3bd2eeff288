package com.sandy.debrisflow.monitor.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * DEM-of-difference summary produced by the external change service. When {@code netChangeM3} is
 * absent it is derived as deposition minus erosion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangeDetectionPayload {
    private Long baselineSnapshotId;
    private Long comparisonSnapshotId;
    private LocalDateTime detectedAt;
    private String dodRasterPath;
    private Double totalErosionM3;
    private Double totalDepositionM3;
    private Double netChangeM3;
    private Double maxErosionM;
    private Double maxDepositionM;
    private Double changeAreaM2;
    private Double lodThresholdM;
    private String footprintWkt;
}
