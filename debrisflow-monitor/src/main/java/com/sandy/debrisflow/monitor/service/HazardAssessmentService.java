package com.sandy.debrisflow.monitor.service;

import com.sandy.debrisflow.monitor.config.RiskProperties;
import com.sandy.debrisflow.monitor.entity.MonitoredLocation;
import com.sandy.debrisflow.monitor.entity.RainfallEvent;
import com.sandy.debrisflow.monitor.entity.RiskLevel;
import com.sandy.debrisflow.monitor.entity.SourceArea;
import com.sandy.debrisflow.monitor.entity.TerrainSnapshot;
import com.sandy.debrisflow.monitor.entity.WeatherObservation;
import com.sandy.debrisflow.monitor.event.RiskAssessedEvent;
import com.sandy.debrisflow.monitor.repository.MonitoredLocationRepository;
import com.sandy.debrisflow.monitor.repository.RainfallEventRepository;
import com.sandy.debrisflow.monitor.repository.SourceAreaRepository;
import com.sandy.debrisflow.monitor.repository.TerrainSnapshotRepository;
import com.sandy.debrisflow.monitor.repository.WeatherObservationRepository;
import com.sandy.debrisflow.monitor.tools.GeoUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Point;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Applies the risk model to a rainfall event against the source areas around its location and
 * stores the result on the event.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HazardAssessmentService {

    private final RiskEvaluator riskEvaluator;
    private final RiskProperties riskProperties;
    private final MonitoredLocationRepository locationRepository;
    private final TerrainSnapshotRepository terrainSnapshotRepository;
    private final SourceAreaRepository sourceAreaRepository;
    private final RainfallEventRepository eventRepository;
    private final WeatherObservationRepository observationRepository;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Re-assesses {@code event}, persists the derived fields and publishes {@link RiskAssessedEvent}.
     *
     * @return the saved event
     */
    public RainfallEvent assess(RainfallEvent event, RainfallWindows windows) {
        EventConditions conditions = EventConditions.of(event, windows);
        RiskAssessment assessment = assess(conditions, event.getLocationId());

        RiskLevel previous = event.getRiskLevel();
        event.setTriggerProbability(assessment.triggerProbability());
        event.setRiskValue(assessment.riskValue());
        event.setRiskLevel(assessment.riskLevel());
        event.setDegraded(assessment.degraded());
        if (assessment.thresholdExceeded()) {
            event.setThresholdExceeded(true);
        }
        RainfallEvent saved = eventRepository.save(event);
        if (previous != assessment.riskLevel()) {
            log.info("Risk level changed eventId={} locationId={} {} -> {} value={}",
                    saved.getId(), saved.getLocationId(), previous, assessment.riskLevel(),
                    String.format("%.3f", assessment.riskValue()));
        }
        if (assessment.degraded()) {
            log.warn("Degraded risk assessment eventId={} reasons={}", saved.getId(), assessment.degradedReasons());
        }
        eventPublisher.publishEvent(new RiskAssessedEvent(saved.getId(), saved.getLocationId(), saved.isActive(),
                previous, assessment));
        return saved;
    }

    /**
     * Evaluates the conditions against every source area in range of the location; the highest risk wins.
     * With no source area in range the result is degraded and uses the configured defaults.
     */
    public RiskAssessment assess(EventConditions conditions, Long locationId) {
        List<SourceArea> areas = sourceAreasNear(locationId);
        if (areas.isEmpty()) {
            return riskEvaluator.evaluate(conditions, null);
        }
        return areas.stream()
                .map(a -> riskEvaluator.evaluate(conditions, a))
                .max(Comparator.comparingDouble(RiskAssessment::riskValue))
                .orElseThrow();
    }

    /**
     * Rebuilds the rainfall conditions of an event from stored observations, for callers that do
     * not run on the location's worker and so cannot read the live windows.
     */
    public EventConditions conditionsFromStore(RainfallEvent event) {
        // same 7d window the live windows hold at the event's latest observation: (last - 7d, last]
        LocalDateTime last = event.getLastObservationAt() != null ? event.getLastObservationAt() : event.getStartTime();
        double sevenDay = observationRepository
                .findByLocationIdAndTimestampBetweenOrderByTimestampAsc(event.getLocationId(),
                        last.minus(WindowSpan.SEVEN_DAYS.duration()).plusNanos(1), last)
                .stream().mapToDouble(WeatherObservation::getRainfallMm).sum();
        return EventConditions.of(event, sevenDay);
    }

    /** Source areas of the latest terrain snapshot within the configured radius of a location. */
    public List<SourceArea> sourceAreasNear(Long locationId) {
        Optional<MonitoredLocation> location = locationRepository.findById(locationId);
        Optional<TerrainSnapshot> snapshot = terrainSnapshotRepository.findTopByOrderByCapturedAtDesc();
        if (location.isEmpty() || snapshot.isEmpty()) {
            return List.of();
        }
        Point p = GeoUtils.point(location.get().getLongitude(), location.get().getLatitude());
        double radius = riskProperties.getSourceAreaRadiusM();
        return sourceAreaRepository.findByTerrainSnapshotId(snapshot.get().getId()).stream()
                .filter(a -> {
                    Geometry g = GeoUtils.parse(a.getGeometryWkt());
                    return GeoUtils.distanceMeters(p, g) <= radius;
                })
                .toList();
    }
}
