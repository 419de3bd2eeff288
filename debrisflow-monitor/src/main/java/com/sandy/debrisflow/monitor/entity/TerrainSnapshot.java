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
 * A dated elevation/imagery capture. Raster paths are references only; the rasters live elsewhere.
 */
@Entity
@Immutable
@Table(name = "terrain_snapshots", indexes = @Index(name = "idx_terrain_captured", columnList = "capturedAt"))
@Getter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TerrainSnapshot {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 100, nullable = false, unique = true)
    private String versionName;

    @Column(nullable = false)
    private LocalDateTime capturedAt;

    @Column(nullable = false)
    private String demPath;
    private String dtmPath;
    private String orthoPath;

    private double resolutionM;
    private int epsgCode;

    /** Spatial extent, WKT polygon in WGS84. */
    @Lob
    @Column(columnDefinition = "CLOB", nullable = false)
    private String extentWkt;

    /** baseline, sentinel2, lidar, ... */
    @Column(length = 50, nullable = false)
    private String source;

    private LocalDateTime createdAt;
}
