package com.sandy.debrisflow.monitor.controller;

import com.sandy.debrisflow.monitor.entity.MonitoredLocation;
import com.sandy.debrisflow.monitor.entity.RainfallEvent;
import com.sandy.debrisflow.monitor.exception.ResourceNotFoundException;
import com.sandy.debrisflow.monitor.repository.MonitoredLocationRepository;
import com.sandy.debrisflow.monitor.repository.RainfallEventRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class LocationController {

    private final MonitoredLocationRepository locationRepository;
    private final RainfallEventRepository eventRepository;

    @GetMapping("/locations")
    public List<MonitoredLocation> locations() {
        return locationRepository.findAll();
    }

    @GetMapping("/events/active")
    public List<RainfallEvent> activeEvents() {
        return eventRepository.findByActiveTrueOrderByStartTimeDesc();
    }

    @GetMapping("/events")
    public List<RainfallEvent> events(@RequestParam Long locationId) {
        return eventRepository.findByLocationIdOrderByStartTimeDesc(locationId);
    }

    @GetMapping("/events/{id}")
    public RainfallEvent event(@PathVariable Long id) {
        return eventRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("rainfall event", id));
    }
}
