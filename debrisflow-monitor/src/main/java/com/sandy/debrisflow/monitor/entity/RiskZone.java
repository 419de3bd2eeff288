package com.sandy.debrisflow.monitor.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

/**
 * Spatial risk output of a completed simulation run.
 */
@Entity
@Immutable
@Table(name = "risk_zones", indexes = {
        @Index(name = "idx_risk_timestamp", columnList = "timestamp"),
        @Index(name = "idx_risk_level", columnList = "riskLevel")
})
@Getter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskZone {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private Long simulationRunId;

    @Column(nullable = false)
    private LocalDateTime timestamp;

    @Lob
    @Column(columnDefinition = "CLOB", nullable = false)
    private String geometryWkt;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private RiskLevel riskLevel;

    @Column(nullable = false)
    private double riskValue;

    private Double triggerProbability;
    private Double runoutProbability;
    private Double flowIntensity;
    private Double affectedAreaM2;
    private boolean degraded;

    private LocalDateTime createdAt;
}
