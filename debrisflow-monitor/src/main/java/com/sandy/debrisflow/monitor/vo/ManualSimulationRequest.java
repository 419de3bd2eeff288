package com.sandy.debrisflow.monitor.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualSimulationRequest {
    private Long terrainSnapshotId;
    private Long rainfallEventId;
    private String modelName;
    private String modelVersion;
    private Map<String, Object> parameters;
    private String requestedBy;
}
