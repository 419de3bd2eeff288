package com.sandy.debrisflow.monitor.service;

import com.sandy.debrisflow.monitor.entity.TerrainSnapshot;
import com.sandy.debrisflow.monitor.entity.TriggerType;
import com.sandy.debrisflow.monitor.exception.DuplicateDispatchException;
import com.sandy.debrisflow.monitor.repository.TerrainSnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Periodic baseline runs against the latest terrain snapshot, independent of rainfall.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SimulationScheduler {

    private final SimulationDispatcher dispatcher;
    private final TerrainSnapshotRepository terrainSnapshotRepository;

    @Value("${simulation.schedule.enabled:false}")
    private boolean enabled;

    @Scheduled(cron = "${simulation.schedule.cron:0 0 */6 * * *}")
    public void scheduledTick() {
        if (!enabled) return;
        tick();
    }

    /** @return true when a run was dispatched */
    public boolean tick() {
        Optional<TerrainSnapshot> snapshot = terrainSnapshotRepository.findTopByOrderByCapturedAtDesc();
        if (snapshot.isEmpty()) {
            log.info("Scheduled simulation skipped: no terrain snapshot registered");
            return false;
        }
        try {
            dispatcher.dispatch(DispatchRequest.of(TriggerType.SCHEDULED, snapshot.get().getId(), null, "scheduler"));
            return true;
        } catch (DuplicateDispatchException e) {
            log.info("Scheduled simulation skipped: {}", e.getMessage());
            return false;
        }
    }
}
