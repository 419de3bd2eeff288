package com.sandy.debrisflow.monitor.service;

import com.sandy.debrisflow.monitor.entity.MonitoredLocation;
import com.sandy.debrisflow.monitor.entity.RainfallEvent;
import com.sandy.debrisflow.monitor.entity.RiskLevel;
import com.sandy.debrisflow.monitor.entity.RiskZone;
import com.sandy.debrisflow.monitor.entity.SimulationRun;
import com.sandy.debrisflow.monitor.repository.MonitoredLocationRepository;
import com.sandy.debrisflow.monitor.repository.RainfallEventRepository;
import com.sandy.debrisflow.monitor.repository.RiskZoneRepository;
import com.sandy.debrisflow.monitor.repository.SimulationRunRepository;
import com.sandy.debrisflow.monitor.vo.LocationRiskVO;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Read-only projection of the current risk per location. Nothing here is stored; every call
 * derives the view from events, runs and zones.
 */
@Service
@RequiredArgsConstructor
public class RiskStateService {

    private final MonitoredLocationRepository locationRepository;
    private final RainfallEventRepository eventRepository;
    private final SimulationRunRepository runRepository;
    private final RiskZoneRepository riskZoneRepository;
    private final HazardAssessmentService hazardAssessmentService;

    public List<LocationRiskVO> currentRisk() {
        return locationRepository.findAll().stream().map(this::project).toList();
    }

    public LocationRiskVO currentRisk(MonitoredLocation location) {
        return project(location);
    }

    private LocationRiskVO project(MonitoredLocation location) {
        LocationRiskVO vo = new LocationRiskVO();
        vo.setLocationId(location.getId());
        vo.setCode(location.getCode());
        vo.setName(location.getName());
        vo.setLongitude(location.getLongitude());
        vo.setLatitude(location.getLatitude());
        vo.setRiskLevel(RiskLevel.LOW);
        vo.setReasons(List.of());
        vo.setDegradedReasons(List.of());

        List<RainfallEvent> events = eventRepository.findByLocationIdOrderByStartTimeDesc(location.getId());
        Optional<RainfallEvent> active = events.stream().filter(RainfallEvent::isActive).findFirst();
        if (active.isPresent()) {
            RainfallEvent event = active.get();
            vo.setEventId(event.getId());
            vo.setEventActive(true);
            vo.setEventStart(event.getStartTime());
            vo.setTotalRainfallMm(event.getTotalRainfallMm());
            vo.setMaxIntensityMmHr(event.getMaxIntensityMmHr());
            vo.setThresholdExceeded(event.isThresholdExceeded());

            RiskAssessment a = hazardAssessmentService.assess(hazardAssessmentService.conditionsFromStore(event), location.getId());
            vo.setRiskLevel(a.riskLevel());
            vo.setRiskValue(a.riskValue());
            vo.setTriggerProbability(a.triggerProbability());
            vo.setExceedanceRatio(a.exceedanceRatio());
            vo.setSaturation(a.saturation());
            vo.setDegraded(a.degraded());
            vo.setDegradedReasons(a.degradedReasons());
            vo.setSimulationRecommended(a.simulationRecommended());
            vo.setReasons(a.reasons());
        } else if (!events.isEmpty()) {
            vo.setEventId(events.get(0).getId());
            vo.setEventStart(events.get(0).getStartTime());
        }

        if (!events.isEmpty()) {
            List<Long> runIds = runRepository.findByRainfallEventIdIn(events.stream().map(RainfallEvent::getId).toList())
                    .stream().map(SimulationRun::getId).toList();
            if (!runIds.isEmpty()) {
                riskZoneRepository.findTopBySimulationRunIdInOrderByTimestampDesc(runIds).ifPresent(z -> applyZone(vo, z));
            }
        }
        return vo;
    }

    private static void applyZone(LocationRiskVO vo, RiskZone zone) {
        vo.setLatestZoneId(zone.getId());
        vo.setLatestZoneLevel(zone.getRiskLevel());
        vo.setLatestZoneRiskValue(zone.getRiskValue());
        vo.setLatestZoneAt(zone.getTimestamp());
    }
}
