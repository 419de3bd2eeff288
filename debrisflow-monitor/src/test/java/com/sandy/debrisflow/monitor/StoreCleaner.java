package com.sandy.debrisflow.monitor;

import com.sandy.debrisflow.monitor.repository.*;
import com.sandy.debrisflow.monitor.service.RainfallAggregator;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Empties every table and the in-memory rainfall windows between tests sharing one context.
 */
@Component
@Profile("test")
@RequiredArgsConstructor
public class StoreCleaner {

    private final AlertRepository alertRepository;
    private final RiskZoneRepository riskZoneRepository;
    private final SimulationRunRepository simulationRunRepository;
    private final RainfallEventRepository rainfallEventRepository;
    private final WeatherObservationRepository observationRepository;
    private final MonitoredLocationRepository locationRepository;
    private final ChangeDetectionRepository changeDetectionRepository;
    private final SourceAreaRepository sourceAreaRepository;
    private final TerrainSnapshotRepository terrainSnapshotRepository;
    private final RainfallAggregator aggregator;
    private final InMemorySimulationExecutor executor;

    public void clean() {
        alertRepository.deleteAll();
        riskZoneRepository.deleteAll();
        simulationRunRepository.deleteAll();
        rainfallEventRepository.deleteAll();
        observationRepository.deleteAll();
        locationRepository.deleteAll();
        changeDetectionRepository.deleteAll();
        sourceAreaRepository.deleteAll();
        terrainSnapshotRepository.deleteAll();
        aggregator.clear();
        executor.reset();
    }
}
