package com.sandy.debrisflow.monitor.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.debrisflow.monitor.entity.RainfallEvent;
import com.sandy.debrisflow.monitor.entity.SimulationRun;
import com.sandy.debrisflow.monitor.entity.SimulationStatus;
import com.sandy.debrisflow.monitor.entity.TerrainSnapshot;
import com.sandy.debrisflow.monitor.entity.TriggerType;
import com.sandy.debrisflow.monitor.event.RiskAssessedEvent;
import com.sandy.debrisflow.monitor.exception.DuplicateDispatchException;
import com.sandy.debrisflow.monitor.exception.ResourceNotFoundException;
import com.sandy.debrisflow.monitor.exception.ValidationException;
import com.sandy.debrisflow.monitor.repository.RainfallEventRepository;
import com.sandy.debrisflow.monitor.repository.SimulationRunRepository;
import com.sandy.debrisflow.monitor.repository.TerrainSnapshotRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Creates simulation runs. Dispatch only records a PENDING run; submission to the executor and
 * everything after it is the {@link SimulationSupervisor}'s job, so callers never wait on the model.
 */
@Service
@Slf4j
public class SimulationDispatcher {

    private static final EnumSet<SimulationStatus> IN_FLIGHT = EnumSet.of(SimulationStatus.PENDING, SimulationStatus.RUNNING);

    private final SimulationRunRepository runRepository;
    private final TerrainSnapshotRepository terrainSnapshotRepository;
    private final RainfallEventRepository eventRepository;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final Object dispatchLock = new Object();

    @Value("${simulation.model.name:saga-gpp}")
    private String defaultModelName;
    @Value("${simulation.model.version:1.0}")
    private String defaultModelVersion;
    @Value("${simulation.auto-dispatch.enabled:true}")
    private boolean autoDispatchEnabled;

    public SimulationDispatcher(SimulationRunRepository runRepository,
                                TerrainSnapshotRepository terrainSnapshotRepository,
                                RainfallEventRepository eventRepository,
                                ObjectMapper objectMapper,
                                PlatformTransactionManager transactionManager,
                                Clock clock) {
        this.runRepository = runRepository;
        this.terrainSnapshotRepository = terrainSnapshotRepository;
        this.eventRepository = eventRepository;
        this.objectMapper = objectMapper;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Records a PENDING run for the request's (snapshot, event) pair.
     *
     * @throws DuplicateDispatchException if a run for the same pair is PENDING or RUNNING
     */
    public SimulationRun dispatch(DispatchRequest request) {
        if (request.triggerType() == null) {
            throw new ValidationException("trigger type is required");
        }
        if (request.terrainSnapshotId() == null) {
            throw new ValidationException("terrain snapshot id is required");
        }
        TerrainSnapshot snapshot = terrainSnapshotRepository.findById(request.terrainSnapshotId())
                .orElseThrow(() -> new ResourceNotFoundException("terrain snapshot", request.terrainSnapshotId()));
        RainfallEvent event = null;
        if (request.rainfallEventId() != null) {
            event = eventRepository.findById(request.rainfallEventId())
                    .orElseThrow(() -> new ResourceNotFoundException("rainfall event", request.rainfallEventId()));
        }
        String parametersJson = buildParameters(snapshot, event, request.parameters());

        // the pair check and the insert must not interleave with another dispatch
        SimulationRun run;
        synchronized (dispatchLock) {
            run = transactionTemplate.execute(status -> {
                List<SimulationRun> inFlight = runRepository.findForPair(request.terrainSnapshotId(), request.rainfallEventId(), IN_FLIGHT);
                if (!inFlight.isEmpty()) {
                    throw new DuplicateDispatchException(request.terrainSnapshotId(), request.rainfallEventId(), inFlight.get(0).getId());
                }
                return runRepository.save(SimulationRun.builder()
                        .terrainSnapshotId(request.terrainSnapshotId())
                        .rainfallEventId(request.rainfallEventId())
                        .triggerType(request.triggerType())
                        .modelName(request.modelName() != null ? request.modelName() : defaultModelName)
                        .modelVersion(request.modelVersion() != null ? request.modelVersion() : defaultModelVersion)
                        .parametersJson(parametersJson)
                        .status(SimulationStatus.PENDING)
                        .requestedBy(request.requestedBy())
                        .createdAt(LocalDateTime.now(clock))
                        .build());
            });
        }
        log.info("Simulation run dispatched id={} trigger={} snapshotId={} eventId={} requestedBy={}",
                run.getId(), run.getTriggerType(), run.getTerrainSnapshotId(), run.getRainfallEventId(), run.getRequestedBy());
        return run;
    }

    /**
     * Dispatches a run for an active event the first time it is assessed above the trigger threshold.
     */
    @EventListener
    public void onRiskAssessed(RiskAssessedEvent assessed) {
        if (!autoDispatchEnabled || !assessed.eventActive() || !assessed.assessment().thresholdExceeded()) {
            return;
        }
        if (runRepository.existsByRainfallEventId(assessed.eventId())) {
            return;
        }
        Optional<TerrainSnapshot> snapshot = terrainSnapshotRepository.findTopByOrderByCapturedAtDesc();
        if (snapshot.isEmpty()) {
            log.warn("Event id={} exceeded threshold but no terrain snapshot is registered; no run dispatched", assessed.eventId());
            return;
        }
        try {
            dispatch(DispatchRequest.of(TriggerType.THRESHOLD_EXCEEDED, snapshot.get().getId(), assessed.eventId(), "system"));
        } catch (DuplicateDispatchException e) {
            log.debug("Threshold dispatch skipped: {}", e.getMessage());
        }
    }

    private String buildParameters(TerrainSnapshot snapshot, RainfallEvent event, Map<String, Object> overrides) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("terrain_snapshot_id", snapshot.getId());
        params.put("terrain_version", snapshot.getVersionName());
        params.put("dem_path", snapshot.getDemPath());
        params.put("resolution_m", snapshot.getResolutionM());
        params.put("epsg", snapshot.getEpsgCode());
        if (event != null) {
            params.put("rainfall_event_id", event.getId());
            params.put("total_rainfall_mm", event.getTotalRainfallMm());
            params.put("max_intensity_mm_hr", event.getMaxIntensityMmHr());
            params.put("duration_minutes", event.getDurationMinutes());
        }
        if (overrides != null) {
            params.putAll(overrides);
        }
        try {
            return objectMapper.writeValueAsString(params);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Simulation parameters are not serializable: " + e.getOriginalMessage());
        }
    }
}
