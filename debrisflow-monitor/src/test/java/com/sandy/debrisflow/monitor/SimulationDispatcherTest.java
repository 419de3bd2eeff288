package com.sandy.debrisflow.monitor;

import com.sandy.debrisflow.monitor.entity.*;
import com.sandy.debrisflow.monitor.exception.DuplicateDispatchException;
import com.sandy.debrisflow.monitor.exception.ValidationException;
import com.sandy.debrisflow.monitor.executor.SimulationMetrics;
import com.sandy.debrisflow.monitor.repository.AlertRepository;
import com.sandy.debrisflow.monitor.repository.RainfallEventRepository;
import com.sandy.debrisflow.monitor.repository.RiskZoneRepository;
import com.sandy.debrisflow.monitor.repository.SimulationRunRepository;
import com.sandy.debrisflow.monitor.service.DispatchRequest;
import com.sandy.debrisflow.monitor.service.SimulationDispatcher;
import com.sandy.debrisflow.monitor.service.SimulationScheduler;
import com.sandy.debrisflow.monitor.service.SimulationSupervisor;
import com.sandy.debrisflow.monitor.service.TerrainService;
import com.sandy.debrisflow.monitor.service.WeatherIngestionService;
import com.sandy.debrisflow.monitor.vo.ObservationPayload;
import com.sandy.debrisflow.monitor.vo.SourceAreaPayload;
import com.sandy.debrisflow.monitor.vo.TerrainSnapshotPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class SimulationDispatcherTest {

    @Autowired StoreCleaner storeCleaner;
    @Autowired InMemorySimulationExecutor executor;
    @Autowired SimulationDispatcher dispatcher;
    @Autowired SimulationSupervisor supervisor;
    @Autowired SimulationScheduler scheduler;
    @Autowired TerrainService terrainService;
    @Autowired WeatherIngestionService ingestionService;
    @Autowired SimulationRunRepository runRepository;
    @Autowired RiskZoneRepository riskZoneRepository;
    @Autowired RainfallEventRepository eventRepository;
    @Autowired AlertRepository alertRepository;

    TerrainSnapshot snapshot;

    @BeforeEach
    void setup() {
        storeCleaner.clean();
        snapshot = terrainService.registerSnapshot(TerrainSnapshotPayload.builder()
                .versionName("lidar-2024")
                .capturedAt(LocalDateTime.of(2024, 4, 1, 0, 0))
                .demPath("/data/dem/2024.tif")
                .resolutionM(1.0)
                .extentWkt("POLYGON((9.9 45.9, 10.1 45.9, 10.1 46.1, 9.9 46.1, 9.9 45.9))")
                .source("lidar")
                .build());
        terrainService.registerSourceArea(SourceAreaPayload.builder()
                .terrainSnapshotId(snapshot.getId())
                .geometryWkt("POLYGON((10.001 46.001, 10.003 46.001, 10.003 46.003, 10.001 46.003, 10.001 46.001))")
                .method("slope_threshold")
                .susceptibility(0.9)
                .slopeDeg(32.0)
                .materialBaseline(0.8)
                .build());
    }

    private SimulationRun manual(Long eventId) {
        return dispatcher.dispatch(DispatchRequest.of(TriggerType.MANUAL, snapshot.getId(), eventId, "alice"));
    }

    private static LocalDateTime now() {
        return LocalDateTime.now(ZoneOffset.UTC);
    }

    private long alertsOfType(AlertType type) {
        return alertRepository.findAll().stream().filter(a -> a.getAlertType() == type).count();
    }

    @Test
    void dispatchOnlyRecordsPendingRun() {
        SimulationRun run = manual(null);
        assertEquals(SimulationStatus.PENDING, run.getStatus());
        assertEquals(TriggerType.MANUAL, run.getTriggerType());
        assertNull(run.getExternalRunId());
        assertTrue(run.getParametersJson().contains("\"dem_path\":\"/data/dem/2024.tif\""));
        assertTrue(executor.submitted().isEmpty(), "executor is only called by the supervisor");
    }

    @Test
    void secondDispatchForSamePairIsRejected() {
        SimulationRun first = manual(null);
        DuplicateDispatchException ex = assertThrows(DuplicateDispatchException.class, () -> manual(null));
        assertEquals(first.getId(), ex.getExistingRunId());

        // still rejected once the run is running
        supervisor.superviseOnce(now());
        assertThrows(DuplicateDispatchException.class, () -> manual(null));
        assertEquals(1, runRepository.count());

        // a terminal run frees the pair
        supervisor.cancel(first.getId(), "alice");
        SimulationRun again = manual(null);
        assertNotEquals(first.getId(), again.getId());
    }

    @Test
    void completedRunProducesExactlyOneRiskZone() {
        SimulationRun run = manual(null);
        supervisor.superviseOnce(now());
        SimulationRun running = runRepository.findById(run.getId()).orElseThrow();
        assertEquals(SimulationStatus.RUNNING, running.getStatus());
        assertNotNull(running.getStartedAt());

        executor.complete(running.getExternalRunId(), SimulationMetrics.builder()
                .runoutAreaM2(1500.0)
                .maxRunoutDistanceM(300.0)
                .affectedVolumeM3(4500.0)
                .maxVelocityMs(6.0)
                .computationTimeS(42.0)
                .build());
        supervisor.superviseOnce(now());
        supervisor.superviseOnce(now());

        SimulationRun done = runRepository.findById(run.getId()).orElseThrow();
        assertEquals(SimulationStatus.COMPLETED, done.getStatus());
        assertEquals(1500.0, done.getRunoutAreaM2());
        assertNotNull(done.getCompletedAt());

        List<RiskZone> zones = riskZoneRepository.findAll();
        assertEquals(1, zones.size());
        RiskZone zone = zones.get(0);
        assertEquals(run.getId(), zone.getSimulationRunId());
        assertEquals(1500.0, zone.getAffectedAreaM2());
        assertEquals(6.0 * 4500.0 / 1500.0, zone.getFlowIntensity(), 1e-9);
        assertTrue(zone.getRiskValue() >= 0 && zone.getRiskValue() <= 1);
        assertEquals(1.0, zone.getRunoutProbability());
    }

    @Test
    void failedRunNeverGetsAZone() {
        SimulationRun run = manual(null);
        supervisor.superviseOnce(now());
        executor.fail(runRepository.findById(run.getId()).orElseThrow().getExternalRunId(), "solver diverged");
        supervisor.superviseOnce(now());

        SimulationRun failed = runRepository.findById(run.getId()).orElseThrow();
        assertEquals(SimulationStatus.FAILED, failed.getStatus());
        assertEquals(FailureCause.EXECUTOR_ERROR, failed.getFailureCause());
        assertEquals("solver diverged", failed.getErrorMessage());
        assertFalse(riskZoneRepository.existsBySimulationRunId(run.getId()));
        assertEquals(1, alertsOfType(AlertType.SIMULATION_FAILED));
    }

    @Test
    void runPastTimeoutFailsWithOneAlert() {
        SimulationRun run = manual(null);
        LocalDateTime submittedAt = now();
        supervisor.superviseOnce(submittedAt);
        String externalId = runRepository.findById(run.getId()).orElseThrow().getExternalRunId();

        supervisor.superviseOnce(submittedAt.plusMinutes(29));
        assertEquals(SimulationStatus.RUNNING, runRepository.findById(run.getId()).orElseThrow().getStatus());

        supervisor.superviseOnce(submittedAt.plusMinutes(30));
        SimulationRun timedOut = runRepository.findById(run.getId()).orElseThrow();
        assertEquals(SimulationStatus.FAILED, timedOut.getStatus());
        assertEquals(FailureCause.TIMEOUT, timedOut.getFailureCause());
        assertTrue(executor.wasCancelled(externalId));

        // a late completion report is ignored
        executor.complete(externalId, SimulationMetrics.builder().runoutAreaM2(1500.0).build());
        supervisor.superviseOnce(submittedAt.plusMinutes(31));
        assertEquals(SimulationStatus.FAILED, runRepository.findById(run.getId()).orElseThrow().getStatus());
        assertEquals(0, riskZoneRepository.count());
        assertEquals(1, alertsOfType(AlertType.SIMULATION_FAILED));
        assertEquals(1, runRepository.count(), "timeouts are not retried");
    }

    @Test
    void cancellationIsCooperativeAndReported() {
        SimulationRun run = manual(null);
        supervisor.superviseOnce(now());
        String externalId = runRepository.findById(run.getId()).orElseThrow().getExternalRunId();

        SimulationRun cancelled = supervisor.cancel(run.getId(), "bob");
        assertEquals(SimulationStatus.FAILED, cancelled.getStatus());
        assertEquals(FailureCause.CANCELLED, cancelled.getFailureCause());
        assertTrue(cancelled.getErrorMessage().contains("bob"));
        assertTrue(executor.wasCancelled(externalId));
        List<Alert> alerts = alertRepository.findAll().stream()
                .filter(a -> a.getAlertType() == AlertType.SIMULATION_FAILED).toList();
        assertEquals(1, alerts.size());
        assertEquals(AlertSeverity.INFO, alerts.get(0).getSeverity());
        assertEquals(run.getId(), alerts.get(0).getRelatedSimulationId());

        assertThrows(ValidationException.class, () -> supervisor.cancel(run.getId(), "bob"));
        assertEquals(1, alertsOfType(AlertType.SIMULATION_FAILED));
    }

    @Test
    void longExecutorErrorStillRaisesAlert() {
        SimulationRun run = manual(null);
        supervisor.superviseOnce(now());
        executor.fail(runRepository.findById(run.getId()).orElseThrow().getExternalRunId(), "x".repeat(1500));
        supervisor.superviseOnce(now());

        SimulationRun failed = runRepository.findById(run.getId()).orElseThrow();
        assertEquals(SimulationStatus.FAILED, failed.getStatus());
        assertEquals(1500, failed.getErrorMessage().length());
        assertEquals(1, alertsOfType(AlertType.SIMULATION_FAILED));
    }

    @Test
    void detailedRunoutFootprintIsStored() {
        StringBuilder wkt = new StringBuilder("POLYGON((");
        int vertices = 400;
        for (int i = 0; i <= vertices; i++) {
            double angle = 2 * Math.PI * (i % vertices) / vertices;
            double radius = 0.01 * (1.0 + 0.1 * Math.sin(7 * angle));
            if (i > 0) wkt.append(", ");
            wkt.append(String.format(Locale.ROOT, "%.9f %.9f",
                    10.002 + radius * Math.cos(angle), 46.002 + radius * Math.sin(angle)));
        }
        wkt.append("))");
        assertTrue(wkt.length() > 8000);

        SimulationRun run = manual(null);
        supervisor.superviseOnce(now());
        executor.complete(runRepository.findById(run.getId()).orElseThrow().getExternalRunId(),
                SimulationMetrics.builder().runoutAreaM2(2.5e6).footprintWkt(wkt.toString()).build());
        supervisor.superviseOnce(now());

        assertEquals(SimulationStatus.COMPLETED, runRepository.findById(run.getId()).orElseThrow().getStatus());
        RiskZone zone = riskZoneRepository.findBySimulationRunId(run.getId()).orElseThrow();
        assertTrue(zone.getGeometryWkt().length() > 8000);
        assertFalse(zone.isDegraded(), "source area lies inside the footprint");
        assertEquals(1, riskZoneRepository.count());
    }

    @Test
    void pendingRunCanBeCancelledBeforeSubmission() {
        SimulationRun run = manual(null);
        supervisor.cancel(run.getId(), "bob");
        supervisor.superviseOnce(now());
        assertTrue(executor.submitted().isEmpty());
        assertEquals(SimulationStatus.FAILED, runRepository.findById(run.getId()).orElseThrow().getStatus());
    }

    @Test
    void executorRefusalFailsRun() {
        executor.failSubmissions("queue full");
        SimulationRun run = manual(null);
        supervisor.superviseOnce(now());
        SimulationRun failed = runRepository.findById(run.getId()).orElseThrow();
        assertEquals(SimulationStatus.FAILED, failed.getStatus());
        assertEquals(FailureCause.EXECUTOR_ERROR, failed.getFailureCause());
        assertEquals(1, alertsOfType(AlertType.SIMULATION_FAILED));
    }

    @Test
    void thresholdExceedingEventDispatchesExactlyOnce() {
        LocalDateTime t0 = now().truncatedTo(ChronoUnit.HOURS).minusDays(1);
        ingestionService.ingest(List.of(
                ObservationPayload.builder().timestamp(t0).longitude(10.0).latitude(46.0)
                        .rainfallMm(20.0).intensityMmHr(25.0).source("station").build(),
                ObservationPayload.builder().timestamp(t0.plusMinutes(30)).longitude(10.0).latitude(46.0)
                        .rainfallMm(15.0).intensityMmHr(30.0).source("station").build()));

        RainfallEvent event = eventRepository.findByActiveTrueOrderByStartTimeDesc().get(0);
        List<SimulationRun> runs = runRepository.findAll();
        assertEquals(1, runs.size());
        assertEquals(TriggerType.THRESHOLD_EXCEEDED, runs.get(0).getTriggerType());
        assertEquals(event.getId(), runs.get(0).getRainfallEventId());
        assertEquals(snapshot.getId(), runs.get(0).getTerrainSnapshotId());

        // event-driven zone uses the registered source area
        supervisor.superviseOnce(now());
        executor.complete(runRepository.findById(runs.get(0).getId()).orElseThrow().getExternalRunId(),
                SimulationMetrics.builder().runoutAreaM2(1500.0).maxRunoutDistanceM(200.0).runoutProbability(0.8).build());
        supervisor.superviseOnce(now());
        RiskZone zone = riskZoneRepository.findBySimulationRunId(runs.get(0).getId()).orElseThrow();
        assertFalse(zone.isDegraded());
        assertEquals(0.8, zone.getRunoutProbability(), 1e-9);
        assertTrue(zone.getGeometryWkt().startsWith("POLYGON"));
    }

    @Test
    void schedulerDispatchesAgainstLatestSnapshot() {
        assertTrue(scheduler.tick());
        assertFalse(scheduler.tick(), "previous scheduled run still in flight");
        SimulationRun run = runRepository.findAll().get(0);
        assertEquals(TriggerType.SCHEDULED, run.getTriggerType());
        assertNull(run.getRainfallEventId());
    }
}
