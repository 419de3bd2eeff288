package com.sandy.debrisflow.monitor.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A debris-initiation polygon. {@code materialAvailability} is only written by the change-detection integrator.
 */
@Entity
@Table(name = "source_areas", indexes = @Index(name = "idx_source_terrain", columnList = "terrainSnapshotId"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceArea {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long terrainSnapshotId;

    @Lob
    @Column(columnDefinition = "CLOB", nullable = false)
    private String geometryWkt;

    /** slope_threshold, contributing_area, ml_model */
    @Column(length = 50, nullable = false)
    private String method;

    private Double susceptibility;
    private Double slopeDeg;
    private Double contributingAreaM2;

    /** Availability before any observed terrain change. */
    private Double materialBaseline;
    private Double materialAvailability;
    private LocalDateTime materialUpdatedAt;

    private LocalDateTime createdAt;

    @Version
    private Long version;
}
