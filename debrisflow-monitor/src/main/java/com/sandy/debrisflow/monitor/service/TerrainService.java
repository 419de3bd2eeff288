package com.sandy.debrisflow.monitor.service;

import com.sandy.debrisflow.monitor.entity.SourceArea;
import com.sandy.debrisflow.monitor.entity.TerrainSnapshot;
import com.sandy.debrisflow.monitor.vo.SourceAreaPayload;
import com.sandy.debrisflow.monitor.vo.TerrainSnapshotPayload;

import java.util.List;

public interface TerrainService {
    TerrainSnapshot registerSnapshot(TerrainSnapshotPayload payload);
    List<TerrainSnapshot> listSnapshots();
    TerrainSnapshot getSnapshot(Long id);
    SourceArea registerSourceArea(SourceAreaPayload payload);
    List<SourceArea> listSourceAreas(Long terrainSnapshotId);
}
