package com.sandy.debrisflow.monitor.service;

import com.sandy.debrisflow.monitor.entity.Alert;
import com.sandy.debrisflow.monitor.entity.AlertSeverity;
import com.sandy.debrisflow.monitor.entity.AlertType;
import com.sandy.debrisflow.monitor.entity.FailureCause;
import com.sandy.debrisflow.monitor.entity.RiskLevel;
import com.sandy.debrisflow.monitor.event.RainfallEventClosedEvent;
import com.sandy.debrisflow.monitor.event.RiskAssessedEvent;
import com.sandy.debrisflow.monitor.event.SimulationRunFailedEvent;
import com.sandy.debrisflow.monitor.event.TerrainChangeDetectedEvent;
import com.sandy.debrisflow.monitor.exception.ResourceNotFoundException;
import com.sandy.debrisflow.monitor.repository.AlertRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Derives operator alerts from pipeline transitions.
 * <p>
 * An alert is identified by its signature (type plus related entity). While an unacknowledged alert
 * with the same signature exists, a recurrence refreshes it instead of creating a new one; after
 * acknowledgement a recurrence opens a fresh alert. All derivation is serialized on this bean.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertManager {

    private final AlertRepository alertRepository;
    private final Clock clock;

    @Value("${alert.enabled:true}")
    private boolean enabled;
    @Value("${alert.terrain-change-net-m3:500}")
    private double terrainChangeNetM3;

    private static final int TITLE_MAX = 200;
    private static final int MESSAGE_MAX = 1000;
    private static final DateTimeFormatter TS_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @PostConstruct
    public void init() {
        log.info("Alert manager initialized: enabled={} terrainChangeNetM3={}", enabled, terrainChangeNetM3);
    }

    @EventListener
    public void onRiskAssessed(RiskAssessedEvent e) {
        RiskAssessment a = e.assessment();
        RiskLevel previous = e.previousLevel() != null ? e.previousLevel() : RiskLevel.LOW;
        if (a.riskLevel().isAbove(previous) && a.riskLevel().isAbove(RiskLevel.MODERATE)) {
            raise(AlertType.HIGH_RISK,
                    a.riskLevel() == RiskLevel.CRITICAL ? AlertSeverity.CRITICAL : AlertSeverity.WARNING,
                    "Risk level " + a.riskLevel() + " at location " + e.locationId(),
                    String.format("Rainfall event %d raised risk from %s to %s (value %.2f, trigger probability %.2f)",
                            e.eventId(), previous, a.riskLevel(), a.riskValue(), a.triggerProbability()),
                    signature(AlertType.HIGH_RISK, "event", e.eventId()),
                    null, e.eventId(), e.locationId(), null);
        }
        if (a.degraded()) {
            raise(AlertType.DEGRADED_ASSESSMENT, AlertSeverity.INFO,
                    "Degraded risk assessment at location " + e.locationId(),
                    "Risk for rainfall event " + e.eventId() + " used default inputs: " + String.join("; ", a.degradedReasons()),
                    signature(AlertType.DEGRADED_ASSESSMENT, "event", e.eventId()),
                    null, e.eventId(), e.locationId(), null);
        }
    }

    @EventListener
    public void onRunFailed(SimulationRunFailedEvent e) {
        raise(AlertType.SIMULATION_FAILED,
                e.cause() == FailureCause.CANCELLED ? AlertSeverity.INFO : AlertSeverity.WARNING,
                failureTitle(e.cause()) + e.runId(),
                String.format("Run %d failed (%s): %s", e.runId(), e.cause(), e.errorMessage()),
                signature(AlertType.SIMULATION_FAILED, "sim", e.runId()),
                e.runId(), e.rainfallEventId(), null, null);
    }

    @EventListener
    public void onEventClosed(RainfallEventClosedEvent e) {
        if (!e.thresholdExceeded()) {
            return;
        }
        raise(AlertType.THRESHOLD_EXCEEDED, AlertSeverity.WARNING,
                "Rainfall threshold exceeded at location " + e.locationId(),
                String.format("Rainfall event %d (%s to %s) exceeded the trigger threshold: total %.1f mm, peak %.1f mm/h",
                        e.eventId(), TS_FMT.format(e.startTime()), TS_FMT.format(e.endTime()),
                        e.totalRainfallMm(), e.maxIntensityMmHr()),
                signature(AlertType.THRESHOLD_EXCEEDED, "event", e.eventId()),
                null, e.eventId(), e.locationId(), null);
    }

    @EventListener
    public void onTerrainChange(TerrainChangeDetectedEvent e) {
        if (Math.abs(e.netChangeM3()) < terrainChangeNetM3) {
            return;
        }
        raise(AlertType.TERRAIN_CHANGE,
                e.affectedSourceAreaIds().isEmpty() ? AlertSeverity.INFO : AlertSeverity.WARNING,
                "Significant terrain change detected",
                String.format("Change detection %d: net %.0f m3 over %.0f m2, source areas affected: %s",
                        e.changeDetectionId(), e.netChangeM3(), e.changeAreaM2(), e.affectedSourceAreaIds()),
                signature(AlertType.TERRAIN_CHANGE, "change", e.changeDetectionId()),
                null, null, null, e.changeDetectionId());
    }

    /**
     * Creates an alert or refreshes the open one with the same signature. Severity only escalates.
     *
     * @return the created or refreshed alert, or empty when alerting is disabled
     */
    public synchronized Optional<Alert> raise(AlertType type, AlertSeverity severity, String title, String message,
                                              String signature, Long simulationId, Long eventId, Long locationId,
                                              Long changeDetectionId) {
        if (!enabled) return Optional.empty();
        LocalDateTime now = LocalDateTime.now(clock);
        title = clip(title, TITLE_MAX);
        message = clip(message, MESSAGE_MAX);
        Optional<Alert> open = alertRepository.findTopBySignatureAndAcknowledgedFalseOrderByCreatedAtDesc(signature);
        if (open.isPresent()) {
            Alert existing = open.get();
            existing.setMessage(message);
            existing.setTitle(title);
            existing.setSeverity(existing.getSeverity().max(severity));
            existing.setOccurrenceCount(existing.getOccurrenceCount() + 1);
            existing.setLastSeenAt(now);
            Alert saved = alertRepository.save(existing);
            log.info("Alert refreshed id={} signature={} occurrences={} severity={}",
                    saved.getId(), signature, saved.getOccurrenceCount(), saved.getSeverity());
            return Optional.of(saved);
        }
        Alert alert = alertRepository.save(Alert.builder()
                .alertType(type)
                .severity(severity)
                .title(title)
                .message(message)
                .relatedSimulationId(simulationId)
                .relatedEventId(eventId)
                .relatedLocationId(locationId)
                .relatedChangeDetectionId(changeDetectionId)
                .signature(signature)
                .occurrenceCount(1)
                .lastSeenAt(now)
                .createdAt(now)
                .acknowledged(false)
                .build());
        log.info("Created {} alert id={} signature={} severity={}", type, alert.getId(), signature, severity);
        return Optional.of(alert);
    }

    /**
     * Records the operator's acknowledgement. Acknowledging twice keeps the first record.
     */
    public synchronized Alert acknowledge(Long alertId, String operator) {
        Alert alert = alertRepository.findById(alertId)
                .orElseThrow(() -> new ResourceNotFoundException("alert", alertId));
        if (alert.isAcknowledged()) {
            return alert;
        }
        alert.setAcknowledged(true);
        alert.setAcknowledgedAt(LocalDateTime.now(clock));
        alert.setAcknowledgedBy(operator != null && !operator.isBlank() ? operator : "operator");
        Alert saved = alertRepository.save(alert);
        log.info("Alert acknowledged id={} by={}", saved.getId(), saved.getAcknowledgedBy());
        return saved;
    }

    public boolean isEnabled() { return enabled; }

    private static String failureTitle(FailureCause cause) {
        return switch (cause) {
            case TIMEOUT -> "Simulation timed out: run ";
            case CANCELLED -> "Simulation cancelled: run ";
            default -> "Simulation failed: run ";
        };
    }

    // executor errors can be longer than the alert columns
    private static String clip(String s, int max) {
        if (s == null || s.length() <= max) return s;
        return s.substring(0, max - 3) + "...";
    }

    static String signature(AlertType type, String kind, Long id) {
        return type.name() + ":" + kind + ":" + id;
    }
}
