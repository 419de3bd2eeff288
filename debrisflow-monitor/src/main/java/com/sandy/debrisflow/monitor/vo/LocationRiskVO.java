package com.sandy.debrisflow.monitor.vo;

import com.sandy.debrisflow.monitor.entity.RiskLevel;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Current-risk projection of one monitored location, derived on read.
 */
@Data
public class LocationRiskVO {
    private Long locationId;
    private String code;
    private String name;
    private double longitude;
    private double latitude;

    private Long eventId;
    private boolean eventActive;
    private LocalDateTime eventStart;
    private Double totalRainfallMm;
    private Double maxIntensityMmHr;
    private boolean thresholdExceeded;

    private RiskLevel riskLevel;
    private double riskValue;
    private Double triggerProbability;
    private Double exceedanceRatio;
    private Double saturation;
    private boolean degraded;
    private List<String> degradedReasons;

    private boolean simulationRecommended;
    private List<String> reasons;

    private Long latestZoneId;
    private RiskLevel latestZoneLevel;
    private Double latestZoneRiskValue;
    private LocalDateTime latestZoneAt;
}
