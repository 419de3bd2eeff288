package com.sandy.debrisflow.monitor.controller;

import com.sandy.debrisflow.monitor.entity.SimulationRun;
import com.sandy.debrisflow.monitor.entity.SimulationStatus;
import com.sandy.debrisflow.monitor.entity.TriggerType;
import com.sandy.debrisflow.monitor.exception.ResourceNotFoundException;
import com.sandy.debrisflow.monitor.exception.ValidationException;
import com.sandy.debrisflow.monitor.repository.SimulationRunRepository;
import com.sandy.debrisflow.monitor.service.DispatchRequest;
import com.sandy.debrisflow.monitor.service.SimulationDispatcher;
import com.sandy.debrisflow.monitor.service.SimulationSupervisor;
import com.sandy.debrisflow.monitor.vo.ManualSimulationRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

/**
 * Operator control of simulation runs. A duplicate manual trigger answers 409 with the in-flight run id.
 */
@RestController
@RequestMapping("/api/simulations")
@RequiredArgsConstructor
public class SimulationController {

    private final SimulationDispatcher dispatcher;
    private final SimulationSupervisor supervisor;
    private final SimulationRunRepository runRepository;

    @PostMapping
    public ResponseEntity<SimulationRun> trigger(@RequestBody ManualSimulationRequest req) {
        if (req == null) throw new ValidationException("request body is required");
        SimulationRun run = dispatcher.dispatch(new DispatchRequest(TriggerType.MANUAL, req.getTerrainSnapshotId(),
                req.getRainfallEventId(), req.getModelName(), req.getModelVersion(),
                req.getParameters() != null ? req.getParameters() : Map.of(),
                req.getRequestedBy() != null ? req.getRequestedBy() : "operator"));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(run);
    }

    @PostMapping("/{id}/cancel")
    public SimulationRun cancel(@PathVariable Long id, @RequestParam(required = false) String operator) {
        return supervisor.cancel(id, operator);
    }

    @GetMapping
    public List<SimulationRun> list(@RequestParam(required = false) SimulationStatus status) {
        if (status != null) {
            return runRepository.findByStatusInOrderByCreatedAtDesc(EnumSet.of(status));
        }
        return runRepository.findTop50ByOrderByCreatedAtDesc();
    }

    @GetMapping("/{id}")
    public SimulationRun get(@PathVariable Long id) {
        return runRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("simulation run", id));
    }
}
