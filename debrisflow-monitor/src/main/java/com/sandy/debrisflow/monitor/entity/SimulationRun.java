package com.sandy.debrisflow.monitor.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One invocation of the external debris-flow model.
 */
@Entity
@Table(name = "simulation_runs", indexes = {
        @Index(name = "idx_simulation_status", columnList = "status"),
        @Index(name = "idx_simulation_pair", columnList = "terrainSnapshotId,rainfallEventId")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimulationRun {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long terrainSnapshotId;
    private Long rainfallEventId;

    @Enumerated(EnumType.STRING)
    @Column(length = 32, nullable = false)
    private TriggerType triggerType;

    @Column(length = 50, nullable = false)
    private String modelName;
    @Column(length = 20)
    private String modelVersion;

    @Lob
    @Column(columnDefinition = "CLOB")
    private String parametersJson;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private SimulationStatus status;

    @Column(length = 120)
    private String externalRunId;
    @Column(length = 100)
    private String requestedBy;

    private String outputPath;
    private Double runoutAreaM2;
    private Double maxRunoutDistanceM;
    private Double affectedVolumeM3;
    private Double maxVelocityMs;
    private Double computationTimeS;

    @Column(length = 2000)
    private String errorMessage;
    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private FailureCause failureCause;

    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    @Version
    private Long version;

    /**
     * Moves the run to {@code next}, refusing any transition the lifecycle does not allow.
     */
    public void transitionTo(SimulationStatus next) {
        if (status == null || !status.canTransitionTo(next)) {
            throw new IllegalStateException("Simulation run " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }
}
