package com.sandy.debrisflow.monitor.repository;

import com.sandy.debrisflow.monitor.entity.RiskZone;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface RiskZoneRepository extends JpaRepository<RiskZone, Long> {
    Optional<RiskZone> findBySimulationRunId(Long simulationRunId);
    boolean existsBySimulationRunId(Long simulationRunId);
    Optional<RiskZone> findTopBySimulationRunIdInOrderByTimestampDesc(Collection<Long> simulationRunIds);
    List<RiskZone> findTop50ByOrderByTimestampDesc();
}
