package com.sandy.debrisflow.monitor.repository;

import com.sandy.debrisflow.monitor.entity.ChangeDetection;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ChangeDetectionRepository extends JpaRepository<ChangeDetection, Long> {
    boolean existsByBaselineSnapshotIdAndComparisonSnapshotId(Long baselineSnapshotId, Long comparisonSnapshotId);
    List<ChangeDetection> findAllByOrderByDetectedAtAsc();
}
