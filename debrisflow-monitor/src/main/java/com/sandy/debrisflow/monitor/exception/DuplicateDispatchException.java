package com.sandy.debrisflow.monitor.exception;

import lombok.Getter;

/**
 * A second dispatch for a terrain snapshot / rainfall event pair that already has a run in flight.
 */
@Getter
public class DuplicateDispatchException extends HazardMonitorException {
    private final Long existingRunId;

    public DuplicateDispatchException(Long terrainSnapshotId, Long rainfallEventId, Long existingRunId) {
        super(String.format("Simulation run %d is already in flight for snapshot=%d event=%s",
                existingRunId, terrainSnapshotId, rainfallEventId));
        this.existingRunId = existingRunId;
    }
}
