package com.sandy.debrisflow.monitor.repository;

import com.sandy.debrisflow.monitor.entity.SimulationRun;
import com.sandy.debrisflow.monitor.entity.SimulationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface SimulationRunRepository extends JpaRepository<SimulationRun, Long> {

    @Query("select r from SimulationRun r where r.terrainSnapshotId = :snapshotId"
            + " and ((:eventId is null and r.rainfallEventId is null) or r.rainfallEventId = :eventId)"
            + " and r.status in :statuses")
    List<SimulationRun> findForPair(@Param("snapshotId") Long terrainSnapshotId,
                                    @Param("eventId") Long rainfallEventId,
                                    @Param("statuses") Collection<SimulationStatus> statuses);

    boolean existsByRainfallEventId(Long rainfallEventId);

    List<SimulationRun> findByStatusOrderByCreatedAtAsc(SimulationStatus status);

    List<SimulationRun> findByStatusInOrderByCreatedAtDesc(Collection<SimulationStatus> statuses);

    List<SimulationRun> findByRainfallEventIdIn(Collection<Long> rainfallEventIds);

    List<SimulationRun> findTop50ByOrderByCreatedAtDesc();
}
