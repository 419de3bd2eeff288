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
 * Volumetric DEM-of-difference summary between two terrain snapshots, produced externally.
 */
@Entity
@Immutable
@Table(name = "change_detections",
        uniqueConstraints = @UniqueConstraint(name = "uk_change_pair", columnNames = {"baselineSnapshotId", "comparisonSnapshotId"}))
@Getter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangeDetection {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private LocalDateTime detectedAt;

    @Column(nullable = false)
    private Long baselineSnapshotId;
    @Column(nullable = false)
    private Long comparisonSnapshotId;

    @Column(nullable = false)
    private String dodRasterPath;

    private double totalErosionM3;
    private double totalDepositionM3;
    private double netChangeM3;
    private Double maxErosionM;
    private Double maxDepositionM;
    private double changeAreaM2;
    private double lodThresholdM;

    /** Area where change was detected; falls back to the comparison snapshot extent when absent. */
    @Lob
    @Column(columnDefinition = "CLOB")
    private String footprintWkt;

    private LocalDateTime createdAt;
}
