package com.sandy.debrisflow.monitor.service;

import com.sandy.debrisflow.monitor.entity.TriggerType;

import java.util.Map;

/**
 * A request to run the model for a terrain snapshot, optionally driven by a rainfall event.
 * Null model fields fall back to the configured model.
 */
public record DispatchRequest(TriggerType triggerType,
                              Long terrainSnapshotId,
                              Long rainfallEventId,
                              String modelName,
                              String modelVersion,
                              Map<String, Object> parameters,
                              String requestedBy) {

    public static DispatchRequest of(TriggerType triggerType, Long terrainSnapshotId, Long rainfallEventId, String requestedBy) {
        return new DispatchRequest(triggerType, terrainSnapshotId, rainfallEventId, null, null, Map.of(), requestedBy);
    }
}
