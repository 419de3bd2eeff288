package com.sandy.debrisflow.monitor.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One record of the weather ingestion feed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObservationPayload {
    private LocalDateTime timestamp;
    private Double longitude;
    private Double latitude;
    private Double rainfallMm;
    private Double intensityMmHr;
    private Double temperatureC;
    private Double humidityPct;
    private Double windSpeedMs;
    private String source;
}
