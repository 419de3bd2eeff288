package com.sandy.debrisflow.monitor.repository;

import com.sandy.debrisflow.monitor.entity.WeatherObservation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface WeatherObservationRepository extends JpaRepository<WeatherObservation, Long> {
    Optional<WeatherObservation> findTopByLocationIdOrderByTimestampDesc(Long locationId);

    // window hydration on first use of a location
    List<WeatherObservation> findByLocationIdAndTimestampAfterOrderByTimestampAsc(Long locationId, LocalDateTime after);

    List<WeatherObservation> findByLocationIdAndTimestampBetweenOrderByTimestampAsc(Long locationId, LocalDateTime from, LocalDateTime to);

    long countByLocationId(Long locationId);
}
