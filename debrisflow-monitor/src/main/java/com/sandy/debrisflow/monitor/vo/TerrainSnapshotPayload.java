package com.sandy.debrisflow.monitor.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TerrainSnapshotPayload {
    private String versionName;
    private LocalDateTime capturedAt;
    private String demPath;
    private String dtmPath;
    private String orthoPath;
    private Double resolutionM;
    private Integer epsgCode;
    private String extentWkt;
    /** lidar, photogrammetry, synthetic */
    private String source;
}
