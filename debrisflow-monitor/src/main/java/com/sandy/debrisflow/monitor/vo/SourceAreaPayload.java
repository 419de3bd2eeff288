package com.sandy.debrisflow.monitor.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceAreaPayload {
    private Long terrainSnapshotId;
    private String geometryWkt;
    private String method;
    private Double susceptibility;
    private Double slopeDeg;
    private Double contributingAreaM2;
    private Double materialBaseline;
}
