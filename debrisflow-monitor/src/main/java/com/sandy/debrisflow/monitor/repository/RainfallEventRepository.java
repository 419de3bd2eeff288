package com.sandy.debrisflow.monitor.repository;

import com.sandy.debrisflow.monitor.entity.RainfallEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RainfallEventRepository extends JpaRepository<RainfallEvent, Long> {
    Optional<RainfallEvent> findByLocationIdAndActiveTrue(Long locationId);
    List<RainfallEvent> findByActiveTrueOrderByStartTimeDesc();
    List<RainfallEvent> findByLocationIdOrderByStartTimeDesc(Long locationId);
    long countByLocationIdAndActiveTrue(Long locationId);
}
