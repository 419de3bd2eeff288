package com.sandy.debrisflow.monitor;

import com.sandy.debrisflow.monitor.entity.Alert;
import com.sandy.debrisflow.monitor.entity.AlertSeverity;
import com.sandy.debrisflow.monitor.entity.AlertType;
import com.sandy.debrisflow.monitor.entity.FailureCause;
import com.sandy.debrisflow.monitor.entity.RiskLevel;
import com.sandy.debrisflow.monitor.event.RiskAssessedEvent;
import com.sandy.debrisflow.monitor.event.SimulationRunFailedEvent;
import com.sandy.debrisflow.monitor.event.TerrainChangeDetectedEvent;
import com.sandy.debrisflow.monitor.exception.ResourceNotFoundException;
import com.sandy.debrisflow.monitor.repository.AlertRepository;
import com.sandy.debrisflow.monitor.service.AlertManager;
import com.sandy.debrisflow.monitor.service.RiskAssessment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class AlertManagerTest {

    @Autowired StoreCleaner storeCleaner;
    @Autowired AlertManager alertManager;
    @Autowired AlertRepository alertRepository;
    @Autowired ApplicationEventPublisher publisher;

    @BeforeEach
    void setup() {
        storeCleaner.clean();
    }

    private static RiskAssessment assessment(RiskLevel level, double value, boolean degraded) {
        return new RiskAssessment(0.5, 1.0, 0.2, value, level, false, degraded,
                degraded ? List.of("no source area in range") : List.of(), null, false, List.of());
    }

    private List<Alert> ofType(AlertType type) {
        return alertRepository.findAll().stream().filter(a -> a.getAlertType() == type).toList();
    }

    @Test
    void repeatedConditionRefreshesOpenAlert() {
        publisher.publishEvent(new SimulationRunFailedEvent(7L, null, FailureCause.EXECUTOR_ERROR, "disk full"));
        publisher.publishEvent(new SimulationRunFailedEvent(7L, null, FailureCause.EXECUTOR_ERROR, "disk still full"));

        List<Alert> alerts = ofType(AlertType.SIMULATION_FAILED);
        assertEquals(1, alerts.size());
        Alert alert = alerts.get(0);
        assertEquals(2, alert.getOccurrenceCount());
        assertTrue(alert.getMessage().contains("disk still full"));
        assertEquals(7L, alert.getRelatedSimulationId());
        assertFalse(alert.getLastSeenAt().isBefore(alert.getCreatedAt()));
    }

    @Test
    void severityOnlyEscalates() {
        String signature = "HIGH_RISK:event:42";
        alertManager.raise(AlertType.HIGH_RISK, AlertSeverity.WARNING, "t", "m1", signature, null, 42L, null, null);
        alertManager.raise(AlertType.HIGH_RISK, AlertSeverity.CRITICAL, "t", "m2", signature, null, 42L, null, null);
        alertManager.raise(AlertType.HIGH_RISK, AlertSeverity.INFO, "t", "m3", signature, null, 42L, null, null);

        List<Alert> alerts = alertRepository.findBySignature(signature);
        assertEquals(1, alerts.size());
        assertEquals(AlertSeverity.CRITICAL, alerts.get(0).getSeverity());
        assertEquals(3, alerts.get(0).getOccurrenceCount());
    }

    @Test
    void recurrenceAfterAcknowledgementOpensNewAlert() {
        publisher.publishEvent(new SimulationRunFailedEvent(8L, null, FailureCause.TIMEOUT, "Exceeded timeout of PT1H"));
        Alert first = ofType(AlertType.SIMULATION_FAILED).get(0);
        assertTrue(first.getTitle().contains("timed out"));

        Alert acked = alertManager.acknowledge(first.getId(), "carol");
        assertTrue(acked.isAcknowledged());
        assertEquals("carol", acked.getAcknowledgedBy());
        assertNotNull(acked.getAcknowledgedAt());

        // acknowledging again keeps the original record
        Alert again = alertManager.acknowledge(first.getId(), "dave");
        assertEquals("carol", again.getAcknowledgedBy());

        publisher.publishEvent(new SimulationRunFailedEvent(8L, null, FailureCause.TIMEOUT, "Exceeded timeout of PT1H"));
        List<Alert> alerts = ofType(AlertType.SIMULATION_FAILED);
        assertEquals(2, alerts.size());
        assertEquals(1, alerts.stream().filter(a -> !a.isAcknowledged()).count());
    }

    @Test
    void acknowledgingUnknownAlertFails() {
        assertThrows(ResourceNotFoundException.class, () -> alertManager.acknowledge(12345L, "carol"));
    }

    @Test
    void cancelledRunRaisesInfoAlert() {
        publisher.publishEvent(new SimulationRunFailedEvent(9L, null, FailureCause.CANCELLED, "Cancelled by bob"));
        List<Alert> alerts = ofType(AlertType.SIMULATION_FAILED);
        assertEquals(1, alerts.size());
        assertEquals(AlertSeverity.INFO, alerts.get(0).getSeverity());
        assertTrue(alerts.get(0).getTitle().startsWith("Simulation cancelled"));
        assertTrue(alerts.get(0).getMessage().contains("Cancelled by bob"));
    }

    @Test
    void oversizedTextIsClippedToFit() {
        String error = "e".repeat(1500);
        publisher.publishEvent(new SimulationRunFailedEvent(10L, null, FailureCause.EXECUTOR_ERROR, error));
        alertManager.raise(AlertType.HIGH_RISK, AlertSeverity.WARNING, "t".repeat(500), "m", "HIGH_RISK:event:10",
                null, 10L, null, null);

        Alert failed = ofType(AlertType.SIMULATION_FAILED).get(0);
        assertEquals(1000, failed.getMessage().length());
        assertTrue(failed.getMessage().endsWith("..."));
        assertEquals(200, ofType(AlertType.HIGH_RISK).get(0).getTitle().length());
    }

    @Test
    void highRiskOnlyWhenLevelRises() {
        publisher.publishEvent(new RiskAssessedEvent(1L, 1L, true, null, assessment(RiskLevel.MODERATE, 0.4, false)));
        assertTrue(ofType(AlertType.HIGH_RISK).isEmpty());

        publisher.publishEvent(new RiskAssessedEvent(1L, 1L, true, RiskLevel.MODERATE, assessment(RiskLevel.HIGH, 0.7, false)));
        assertEquals(AlertSeverity.WARNING, ofType(AlertType.HIGH_RISK).get(0).getSeverity());

        // same level again is not a rise
        publisher.publishEvent(new RiskAssessedEvent(1L, 1L, true, RiskLevel.HIGH, assessment(RiskLevel.HIGH, 0.72, false)));
        assertEquals(1, ofType(AlertType.HIGH_RISK).get(0).getOccurrenceCount());

        publisher.publishEvent(new RiskAssessedEvent(1L, 1L, true, RiskLevel.HIGH, assessment(RiskLevel.CRITICAL, 0.9, false)));
        List<Alert> highRisk = ofType(AlertType.HIGH_RISK);
        assertEquals(1, highRisk.size());
        assertEquals(AlertSeverity.CRITICAL, highRisk.get(0).getSeverity());
        assertEquals(2, highRisk.get(0).getOccurrenceCount());
    }

    @Test
    void degradedAssessmentIsReported() {
        publisher.publishEvent(new RiskAssessedEvent(2L, 3L, true, null, assessment(RiskLevel.LOW, 0.1, true)));
        List<Alert> degraded = ofType(AlertType.DEGRADED_ASSESSMENT);
        assertEquals(1, degraded.size());
        assertEquals(AlertSeverity.INFO, degraded.get(0).getSeverity());
        assertTrue(degraded.get(0).getMessage().contains("no source area in range"));
    }

    @Test
    void smallTerrainChangeIsIgnored() {
        publisher.publishEvent(new TerrainChangeDetectedEvent(5L, 499.0, 100.0, List.of(1L)));
        assertTrue(alertRepository.findAll().isEmpty());
        publisher.publishEvent(new TerrainChangeDetectedEvent(6L, -500.0, 100.0, List.of(1L)));
        assertEquals(AlertSeverity.WARNING, ofType(AlertType.TERRAIN_CHANGE).get(0).getSeverity());
    }
}
