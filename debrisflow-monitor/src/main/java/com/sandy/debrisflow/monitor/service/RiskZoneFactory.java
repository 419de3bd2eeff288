package com.sandy.debrisflow.monitor.service;

import com.sandy.debrisflow.monitor.config.RiskProperties;
import com.sandy.debrisflow.monitor.entity.MonitoredLocation;
import com.sandy.debrisflow.monitor.entity.RainfallEvent;
import com.sandy.debrisflow.monitor.entity.RiskZone;
import com.sandy.debrisflow.monitor.entity.SimulationRun;
import com.sandy.debrisflow.monitor.entity.SourceArea;
import com.sandy.debrisflow.monitor.entity.TerrainSnapshot;
import com.sandy.debrisflow.monitor.executor.SimulationMetrics;
import com.sandy.debrisflow.monitor.repository.MonitoredLocationRepository;
import com.sandy.debrisflow.monitor.repository.RainfallEventRepository;
import com.sandy.debrisflow.monitor.repository.SourceAreaRepository;
import com.sandy.debrisflow.monitor.repository.TerrainSnapshotRepository;
import com.sandy.debrisflow.monitor.tools.GeoUtils;
import lombok.RequiredArgsConstructor;
import org.locationtech.jts.geom.Geometry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Turns the output of a completed run into a {@link RiskZone}. The zone is not saved here; the
 * supervisor persists it in the same transaction as the run's completion.
 */
@Component
@RequiredArgsConstructor
public class RiskZoneFactory {

    private final RiskEvaluator riskEvaluator;
    private final RiskProperties riskProperties;
    private final RainfallEventRepository eventRepository;
    private final MonitoredLocationRepository locationRepository;
    private final TerrainSnapshotRepository terrainSnapshotRepository;
    private final SourceAreaRepository sourceAreaRepository;
    private final HazardAssessmentService hazardAssessmentService;

    @Value("${simulation.zone.default-buffer-m:250}")
    private double defaultBufferM;

    public RiskZone build(SimulationRun run, SimulationMetrics metrics, LocalDateTime now) {
        SimulationMetrics m = metrics != null ? metrics : new SimulationMetrics();
        RainfallEvent event = run.getRainfallEventId() != null
                ? eventRepository.findById(run.getRainfallEventId()).orElse(null)
                : null;
        Geometry footprint = footprint(run, m, event);

        SourceArea dominant = null;
        RiskAssessment assessment = null;
        List<SourceArea> inside = sourceAreaRepository.findByTerrainSnapshotId(run.getTerrainSnapshotId()).stream()
                .filter(a -> GeoUtils.parse(a.getGeometryWkt()).intersects(footprint))
                .toList();
        for (SourceArea a : inside.isEmpty() ? Collections.<SourceArea>singletonList(null) : inside) {
            RiskAssessment candidate = event != null
                    ? riskEvaluator.evaluate(hazardAssessmentService.conditionsFromStore(event), a)
                    : riskEvaluator.evaluate(riskProperties.getIdleTriggerProbability(), a);
            if (assessment == null || candidate.riskValue() > assessment.riskValue()) {
                assessment = candidate;
                dominant = a;
            }
        }
        double runoutProbability = m.getRunoutProbability() != null ? m.getRunoutProbability() : 1.0;
        RiskAssessment zoneRisk = riskEvaluator.scale(assessment, runoutProbability);

        return RiskZone.builder()
                .simulationRunId(run.getId())
                .timestamp(now)
                .geometryWkt(GeoUtils.toWkt(footprint))
                .riskLevel(zoneRisk.riskLevel())
                .riskValue(zoneRisk.riskValue())
                .triggerProbability(zoneRisk.triggerProbability())
                .runoutProbability(RiskEvaluator.clamp(runoutProbability))
                .flowIntensity(flowIntensity(m))
                .affectedAreaM2(m.getRunoutAreaM2() != null ? m.getRunoutAreaM2() : GeoUtils.areaM2(footprint))
                .degraded(zoneRisk.degraded() || dominant == null)
                .createdAt(now)
                .build();
    }

    private Geometry footprint(SimulationRun run, SimulationMetrics m, RainfallEvent event) {
        if (m.getFootprintWkt() != null && !m.getFootprintWkt().isBlank()) {
            return GeoUtils.parse(m.getFootprintWkt());
        }
        double buffer = m.getMaxRunoutDistanceM() != null && m.getMaxRunoutDistanceM() > 0
                ? m.getMaxRunoutDistanceM() : defaultBufferM;
        if (event != null) {
            List<SourceArea> near = hazardAssessmentService.sourceAreasNear(event.getLocationId());
            Optional<Geometry> union = near.stream()
                    .map(a -> GeoUtils.parse(a.getGeometryWkt()))
                    .reduce(Geometry::union);
            if (union.isPresent()) {
                return GeoUtils.bufferMeters(union.get(), buffer);
            }
            Optional<MonitoredLocation> location = locationRepository.findById(event.getLocationId());
            if (location.isPresent()) {
                return GeoUtils.bufferMeters(GeoUtils.point(location.get().getLongitude(), location.get().getLatitude()), buffer);
            }
        }
        return terrainSnapshotRepository.findById(run.getTerrainSnapshotId())
                .map(TerrainSnapshot::getExtentWkt)
                .map(GeoUtils::parse)
                .orElseThrow(() -> new IllegalStateException("No footprint derivable for run " + run.getId()));
    }

    private static Double flowIntensity(SimulationMetrics m) {
        if (m.getMaxVelocityMs() == null || m.getAffectedVolumeM3() == null
                || m.getRunoutAreaM2() == null || m.getRunoutAreaM2() <= 0) {
            return null;
        }
        return m.getMaxVelocityMs() * m.getAffectedVolumeM3() / m.getRunoutAreaM2();
    }
}
