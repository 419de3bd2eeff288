package com.sandy.debrisflow.monitor.repository;

import com.sandy.debrisflow.monitor.entity.SourceArea;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SourceAreaRepository extends JpaRepository<SourceArea, Long> {
    List<SourceArea> findByTerrainSnapshotId(Long terrainSnapshotId);
}
