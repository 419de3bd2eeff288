package com.sandy.debrisflow.monitor.service;

import com.sandy.debrisflow.monitor.entity.MonitoredLocation;
import com.sandy.debrisflow.monitor.repository.MonitoredLocationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Maps feed coordinates to monitored locations. A reading within the match tolerance of a known
 * location belongs to it; anything else registers a new location.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LocationRegistry {

    private final MonitoredLocationRepository locationRepository;
    private final Clock clock;

    @Value("${ingestion.location-match-tolerance-deg:0.001}")
    private double toleranceDeg;

    public synchronized MonitoredLocation resolve(double longitude, double latitude) {
        List<MonitoredLocation> candidates = locationRepository.findByLongitudeBetweenAndLatitudeBetween(
                longitude - toleranceDeg, longitude + toleranceDeg,
                latitude - toleranceDeg, latitude + toleranceDeg);
        if (!candidates.isEmpty()) {
            return candidates.stream()
                    .min(Comparator.comparingDouble(l -> squaredDistance(l, longitude, latitude)))
                    .get();
        }
        String code = String.format(Locale.ROOT, "LOC_%.4f_%.4f", longitude, latitude);
        MonitoredLocation created = locationRepository.save(MonitoredLocation.builder()
                .code(code)
                .name(code)
                .longitude(longitude)
                .latitude(latitude)
                .createdAt(LocalDateTime.now(clock))
                .build());
        log.info("Registered monitored location id={} code={}", created.getId(), code);
        return created;
    }

    private static double squaredDistance(MonitoredLocation l, double lon, double lat) {
        double dx = l.getLongitude() - lon;
        double dy = l.getLatitude() - lat;
        return dx * dx + dy * dy;
    }
}
