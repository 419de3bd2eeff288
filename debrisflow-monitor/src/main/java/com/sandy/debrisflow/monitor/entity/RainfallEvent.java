package com.sandy.debrisflow.monitor.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * A contiguous period of rainfall at one monitored location. Running totals are mutated
 * while the event is active; once closed the row no longer changes.
 */
@Entity
@Table(name = "rainfall_events", indexes = {
        @Index(name = "idx_rainfall_start", columnList = "startTime"),
        @Index(name = "idx_rainfall_location_active", columnList = "locationId,active")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RainfallEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long locationId;

    @Column(nullable = false)
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private Integer durationMinutes;

    private double totalRainfallMm;
    private double maxIntensityMmHr;
    private double avgIntensityMmHr;
    private int observationCount;

    /** Timestamp of the last qualifying observation; drives the inactivity gap. */
    private LocalDateTime lastObservationAt;

    private boolean thresholdExceeded;

    private Double triggerProbability;
    private Double riskValue;
    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private RiskLevel riskLevel;
    private boolean degraded;

    private boolean active;

    private LocalDateTime createdAt;

    @Version
    private Long version;

    /** Hours from start to the last qualifying observation. */
    public double elapsedHours() {
        LocalDateTime until = endTime != null ? endTime : lastObservationAt;
        if (until == null || startTime == null) return 0.0;
        return Duration.between(startTime, until).toSeconds() / 3600.0;
    }
}
