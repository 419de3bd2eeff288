package com.sandy.debrisflow.monitor.repository;

import com.sandy.debrisflow.monitor.entity.TerrainSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TerrainSnapshotRepository extends JpaRepository<TerrainSnapshot, Long> {
    Optional<TerrainSnapshot> findTopByOrderByCapturedAtDesc();
    boolean existsByVersionName(String versionName);
    List<TerrainSnapshot> findAllByOrderByCapturedAtDesc();
}
