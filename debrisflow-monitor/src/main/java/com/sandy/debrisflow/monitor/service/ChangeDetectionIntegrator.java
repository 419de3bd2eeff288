package com.sandy.debrisflow.monitor.service;

import com.sandy.debrisflow.monitor.config.RiskProperties;
import com.sandy.debrisflow.monitor.entity.ChangeDetection;
import com.sandy.debrisflow.monitor.entity.SourceArea;
import com.sandy.debrisflow.monitor.entity.TerrainSnapshot;
import com.sandy.debrisflow.monitor.event.TerrainChangeDetectedEvent;
import com.sandy.debrisflow.monitor.exception.ValidationException;
import com.sandy.debrisflow.monitor.repository.ChangeDetectionRepository;
import com.sandy.debrisflow.monitor.repository.SourceAreaRepository;
import com.sandy.debrisflow.monitor.repository.TerrainSnapshotRepository;
import com.sandy.debrisflow.monitor.tools.GeoUtils;
import com.sandy.debrisflow.monitor.vo.ChangeDetectionPayload;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Folds observed terrain change into the {@code materialAvailability} of source areas.
 * <p>
 * Each change detection contributes {@code min(1, max(net, 0) / referenceVolume) * overlap * 2^(-age / halfLife)}
 * to every source area its buffered footprint overlaps, where {@code overlap} is the share of the
 * source area covered. Availability is the baseline plus all contributions, clamped to [0,1]. The
 * value is always recomputed from scratch, so a refresh simply re-applies decay.
 * <p>
 * This is the only writer of {@code materialAvailability}; each area is updated in its own transaction.
 */
@Service
@Slf4j
public class ChangeDetectionIntegrator {

    private final ChangeDetectionRepository changeRepository;
    private final TerrainSnapshotRepository terrainSnapshotRepository;
    private final SourceAreaRepository sourceAreaRepository;
    private final RiskProperties riskProperties;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Value("${change.reference-volume-m3:1000}")
    private double referenceVolumeM3;
    @Value("${change.half-life:P30D}")
    private Duration halfLife;
    @Value("${change.proximity-buffer-m:50}")
    private double proximityBufferM;
    @Value("${change.refresh.enabled:true}")
    private boolean refreshEnabled;

    public ChangeDetectionIntegrator(ChangeDetectionRepository changeRepository,
                                     TerrainSnapshotRepository terrainSnapshotRepository,
                                     SourceAreaRepository sourceAreaRepository,
                                     RiskProperties riskProperties,
                                     ApplicationEventPublisher eventPublisher,
                                     PlatformTransactionManager transactionManager,
                                     Clock clock) {
        this.changeRepository = changeRepository;
        this.terrainSnapshotRepository = terrainSnapshotRepository;
        this.sourceAreaRepository = sourceAreaRepository;
        this.riskProperties = riskProperties;
        this.eventPublisher = eventPublisher;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Stores one change detection and updates the source areas it touches.
     *
     * @throws ValidationException for malformed records or a snapshot pair that was already ingested
     */
    public synchronized ChangeDetection ingest(ChangeDetectionPayload payload) {
        validate(payload);
        if (changeRepository.existsByBaselineSnapshotIdAndComparisonSnapshotId(payload.getBaselineSnapshotId(), payload.getComparisonSnapshotId())) {
            throw new ValidationException("Change detection for snapshots " + payload.getBaselineSnapshotId()
                    + " -> " + payload.getComparisonSnapshotId() + " already ingested");
        }
        TerrainSnapshot comparison = terrainSnapshotRepository.findById(payload.getComparisonSnapshotId())
                .orElseThrow(() -> new ValidationException("Unknown comparison snapshot " + payload.getComparisonSnapshotId()));
        if (!terrainSnapshotRepository.existsById(payload.getBaselineSnapshotId())) {
            throw new ValidationException("Unknown baseline snapshot " + payload.getBaselineSnapshotId());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        double erosion = orZero(payload.getTotalErosionM3());
        double deposition = orZero(payload.getTotalDepositionM3());
        double net = payload.getNetChangeM3() != null ? payload.getNetChangeM3() : deposition - erosion;
        String footprintWkt = payload.getFootprintWkt() != null && !payload.getFootprintWkt().isBlank()
                ? GeoUtils.toWkt(GeoUtils.parse(payload.getFootprintWkt()))
                : comparison.getExtentWkt();

        ChangeDetection change = changeRepository.save(ChangeDetection.builder()
                .detectedAt(payload.getDetectedAt() != null ? payload.getDetectedAt() : now)
                .baselineSnapshotId(payload.getBaselineSnapshotId())
                .comparisonSnapshotId(payload.getComparisonSnapshotId())
                .dodRasterPath(payload.getDodRasterPath())
                .totalErosionM3(erosion)
                .totalDepositionM3(deposition)
                .netChangeM3(net)
                .maxErosionM(payload.getMaxErosionM())
                .maxDepositionM(payload.getMaxDepositionM())
                .changeAreaM2(orZero(payload.getChangeAreaM2()))
                .lodThresholdM(orZero(payload.getLodThresholdM()))
                .footprintWkt(footprintWkt)
                .createdAt(now)
                .build());
        log.info("Change detection stored id={} pair={}->{} net={}m3 area={}m2",
                change.getId(), change.getBaselineSnapshotId(), change.getComparisonSnapshotId(),
                change.getNetChangeM3(), change.getChangeAreaM2());

        Geometry zone = GeoUtils.bufferMeters(GeoUtils.parse(footprintWkt), proximityBufferM);
        List<Long> affected = new ArrayList<>();
        for (SourceArea area : sourceAreaRepository.findAll()) {
            if (GeoUtils.parse(area.getGeometryWkt()).intersects(zone)) {
                affected.add(area.getId());
            }
        }
        List<ChangeDetection> changes = changeRepository.findAllByOrderByDetectedAtAsc();
        for (Long id : affected) {
            recompute(id, changes, now);
        }
        eventPublisher.publishEvent(new TerrainChangeDetectedEvent(change.getId(), net, change.getChangeAreaM2(), List.copyOf(affected)));
        return change;
    }

    @Scheduled(fixedDelayString = "${change.refresh.interval-ms:3600000}")
    public void scheduledRefresh() {
        if (!refreshEnabled) return;
        try {
            refreshAll(LocalDateTime.now(clock));
        } catch (Exception e) {
            log.error("Material availability refresh failed: {}", e.getMessage(), e);
        }
    }

    /** Recomputes availability of every source area as of {@code now}. */
    public synchronized int refreshAll(LocalDateTime now) {
        List<ChangeDetection> changes = changeRepository.findAllByOrderByDetectedAtAsc();
        int updated = 0;
        for (SourceArea area : sourceAreaRepository.findAll()) {
            if (recompute(area.getId(), changes, now)) updated++;
        }
        log.debug("Material availability refreshed for {} source area(s)", updated);
        return updated;
    }

    /** Recomputes a single source area, e.g. right after it was registered. */
    public synchronized void refresh(Long sourceAreaId) {
        recompute(sourceAreaId, changeRepository.findAllByOrderByDetectedAtAsc(), LocalDateTime.now(clock));
    }

    /**
     * Contribution of one change to one source area geometry as of {@code now}.
     */
    double contribution(Geometry area, ChangeDetection change, LocalDateTime now) {
        double positiveNet = Math.max(0.0, change.getNetChangeM3());
        if (positiveNet == 0.0 || change.getFootprintWkt() == null) {
            return 0.0;
        }
        Geometry zone = GeoUtils.bufferMeters(GeoUtils.parse(change.getFootprintWkt()), proximityBufferM);
        double overlap = GeoUtils.overlapFraction(area, zone);
        if (overlap == 0.0) {
            return 0.0;
        }
        double ageSeconds = Math.max(0, Duration.between(change.getDetectedAt(), now).toSeconds());
        double decay = Math.pow(2.0, -ageSeconds / (double) halfLife.toSeconds());
        return Math.min(1.0, positiveNet / referenceVolumeM3) * overlap * decay;
    }

    private boolean recompute(Long sourceAreaId, List<ChangeDetection> changes, LocalDateTime now) {
        try {
            return Boolean.TRUE.equals(transactionTemplate.execute(status -> {
                SourceArea area = sourceAreaRepository.findById(sourceAreaId).orElse(null);
                if (area == null) return false;
                Geometry geometry = GeoUtils.parse(area.getGeometryWkt());
                double sum = 0.0;
                boolean touched = false;
                for (ChangeDetection c : changes) {
                    double contribution = contribution(geometry, c, now);
                    if (contribution > 0) {
                        sum += contribution;
                        touched = true;
                    }
                }
                if (!touched && area.getMaterialBaseline() == null) {
                    // no evidence either way; the evaluator falls back to its default
                    return false;
                }
                double baseline = area.getMaterialBaseline() != null
                        ? area.getMaterialBaseline() : riskProperties.getDefaultMaterialAvailability();
                double availability = Math.max(0.0, Math.min(1.0, baseline + sum));
                area.setMaterialAvailability(availability);
                area.setMaterialUpdatedAt(now);
                sourceAreaRepository.save(area);
                log.debug("Material availability sourceAreaId={} baseline={} contribution={} -> {}",
                        sourceAreaId, baseline, sum, availability);
                return true;
            }));
        } catch (OptimisticLockingFailureException e) {
            log.warn("Concurrent update of source area id={}, left for the next refresh", sourceAreaId);
            return false;
        }
    }

    private static void validate(ChangeDetectionPayload p) {
        if (p == null) throw new ValidationException("change detection record is null");
        if (p.getBaselineSnapshotId() == null || p.getComparisonSnapshotId() == null) {
            throw new ValidationException("baseline and comparison snapshot ids are required");
        }
        if (p.getBaselineSnapshotId().equals(p.getComparisonSnapshotId())) {
            throw new ValidationException("baseline and comparison snapshot must differ");
        }
        if (p.getDodRasterPath() == null || p.getDodRasterPath().isBlank()) {
            throw new ValidationException("dod_raster_path is required");
        }
        requireNonNegative("total_erosion_m3", p.getTotalErosionM3());
        requireNonNegative("total_deposition_m3", p.getTotalDepositionM3());
        requireNonNegative("change_area_m2", p.getChangeAreaM2());
        requireNonNegative("lod_threshold_m", p.getLodThresholdM());
        if (p.getNetChangeM3() != null && !Double.isFinite(p.getNetChangeM3())) {
            throw new ValidationException("net_change_m3 is not a finite number");
        }
    }

    private static void requireNonNegative(String field, Double v) {
        if (v != null && (!Double.isFinite(v) || v < 0)) {
            throw new ValidationException(field + " must be a non-negative number");
        }
    }

    private static double orZero(Double v) {
        return v != null ? v : 0.0;
    }
}
