package com.sandy.debrisflow.monitor.repository;

import com.sandy.debrisflow.monitor.entity.MonitoredLocation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MonitoredLocationRepository extends JpaRepository<MonitoredLocation, Long> {
    List<MonitoredLocation> findByLongitudeBetweenAndLatitudeBetween(double minLon, double maxLon, double minLat, double maxLat);
}
