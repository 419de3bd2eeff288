package com.sandy.debrisflow.monitor.controller;

import com.sandy.debrisflow.monitor.entity.ChangeDetection;
import com.sandy.debrisflow.monitor.repository.ChangeDetectionRepository;
import com.sandy.debrisflow.monitor.service.ChangeDetectionIntegrator;
import com.sandy.debrisflow.monitor.vo.ChangeDetectionPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Feed of change-detection records from the external DEM differencing service.
 */
@RestController
@RequestMapping("/api/change-detections")
@RequiredArgsConstructor
public class ChangeDetectionController {

    private final ChangeDetectionIntegrator integrator;
    private final ChangeDetectionRepository changeRepository;

    @PostMapping
    public ResponseEntity<ChangeDetection> ingest(@RequestBody ChangeDetectionPayload payload) {
        return ResponseEntity.status(HttpStatus.CREATED).body(integrator.ingest(payload));
    }

    @GetMapping
    public List<ChangeDetection> list() {
        return changeRepository.findAllByOrderByDetectedAtAsc();
    }
}
