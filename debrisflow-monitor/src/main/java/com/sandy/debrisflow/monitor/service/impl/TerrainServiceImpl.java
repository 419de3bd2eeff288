package com.sandy.debrisflow.monitor.service.impl;

import com.sandy.debrisflow.monitor.entity.SourceArea;
import com.sandy.debrisflow.monitor.entity.TerrainSnapshot;
import com.sandy.debrisflow.monitor.exception.ResourceNotFoundException;
import com.sandy.debrisflow.monitor.exception.ValidationException;
import com.sandy.debrisflow.monitor.repository.SourceAreaRepository;
import com.sandy.debrisflow.monitor.repository.TerrainSnapshotRepository;
import com.sandy.debrisflow.monitor.service.ChangeDetectionIntegrator;
import com.sandy.debrisflow.monitor.service.TerrainService;
import com.sandy.debrisflow.monitor.tools.GeoUtils;
import com.sandy.debrisflow.monitor.vo.SourceAreaPayload;
import com.sandy.debrisflow.monitor.vo.TerrainSnapshotPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class TerrainServiceImpl implements TerrainService {

    private final TerrainSnapshotRepository terrainSnapshotRepository;
    private final SourceAreaRepository sourceAreaRepository;
    private final ChangeDetectionIntegrator changeDetectionIntegrator;
    private final Clock clock;

    @Override
    public TerrainSnapshot registerSnapshot(TerrainSnapshotPayload p) {
        if (p == null || p.getVersionName() == null || p.getVersionName().isBlank()) {
            throw new ValidationException("version_name is required");
        }
        if (p.getCapturedAt() == null) throw new ValidationException("captured_at is required");
        if (p.getDemPath() == null || p.getDemPath().isBlank()) throw new ValidationException("dem_path is required");
        if (p.getResolutionM() == null || !(p.getResolutionM() > 0)) throw new ValidationException("resolution_m must be positive");
        if (terrainSnapshotRepository.existsByVersionName(p.getVersionName())) {
            throw new ValidationException("Terrain snapshot '" + p.getVersionName() + "' already registered");
        }
        String extent = GeoUtils.toWkt(GeoUtils.parse(p.getExtentWkt()));
        TerrainSnapshot saved = terrainSnapshotRepository.save(TerrainSnapshot.builder()
                .versionName(p.getVersionName())
                .capturedAt(p.getCapturedAt())
                .demPath(p.getDemPath())
                .dtmPath(p.getDtmPath())
                .orthoPath(p.getOrthoPath())
                .resolutionM(p.getResolutionM())
                .epsgCode(p.getEpsgCode() != null ? p.getEpsgCode() : GeoUtils.WGS84_SRID)
                .extentWkt(extent)
                .source(p.getSource() != null ? p.getSource() : "unknown")
                .createdAt(LocalDateTime.now(clock))
                .build());
        log.info("Terrain snapshot registered id={} version={} captured={}", saved.getId(), saved.getVersionName(), saved.getCapturedAt());
        return saved;
    }

    @Override
    public List<TerrainSnapshot> listSnapshots() { return terrainSnapshotRepository.findAllByOrderByCapturedAtDesc(); }

    @Override
    public TerrainSnapshot getSnapshot(Long id) {
        return terrainSnapshotRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("terrain snapshot", id));
    }

    @Override
    public SourceArea registerSourceArea(SourceAreaPayload p) {
        if (p == null || p.getTerrainSnapshotId() == null) throw new ValidationException("terrain_snapshot_id is required");
        if (!terrainSnapshotRepository.existsById(p.getTerrainSnapshotId())) {
            throw new ResourceNotFoundException("terrain snapshot", p.getTerrainSnapshotId());
        }
        if (p.getMethod() == null || p.getMethod().isBlank()) throw new ValidationException("method is required");
        requireUnit("susceptibility", p.getSusceptibility());
        requireUnit("material_baseline", p.getMaterialBaseline());
        String geometry = GeoUtils.toWkt(GeoUtils.parse(p.getGeometryWkt()));
        SourceArea saved = sourceAreaRepository.save(SourceArea.builder()
                .terrainSnapshotId(p.getTerrainSnapshotId())
                .geometryWkt(geometry)
                .method(p.getMethod())
                .susceptibility(p.getSusceptibility())
                .slopeDeg(p.getSlopeDeg())
                .contributingAreaM2(p.getContributingAreaM2())
                .materialBaseline(p.getMaterialBaseline())
                .materialAvailability(p.getMaterialBaseline())
                .createdAt(LocalDateTime.now(clock))
                .build());
        // changes ingested before the area existed still apply
        changeDetectionIntegrator.refresh(saved.getId());
        log.info("Source area registered id={} snapshotId={} method={}", saved.getId(), saved.getTerrainSnapshotId(), saved.getMethod());
        return sourceAreaRepository.findById(saved.getId()).orElse(saved);
    }

    @Override
    public List<SourceArea> listSourceAreas(Long terrainSnapshotId) {
        return terrainSnapshotId != null ? sourceAreaRepository.findByTerrainSnapshotId(terrainSnapshotId) : sourceAreaRepository.findAll();
    }

    private static void requireUnit(String field, Double v) {
        if (v != null && !(v >= 0 && v <= 1)) {
            throw new ValidationException(field + " must be within [0,1]");
        }
    }
}
