package com.sandy.debrisflow.monitor;

import com.sandy.debrisflow.monitor.entity.Alert;
import com.sandy.debrisflow.monitor.entity.AlertType;
import com.sandy.debrisflow.monitor.entity.RainfallEvent;
import com.sandy.debrisflow.monitor.repository.AlertRepository;
import com.sandy.debrisflow.monitor.repository.MonitoredLocationRepository;
import com.sandy.debrisflow.monitor.repository.RainfallEventRepository;
import com.sandy.debrisflow.monitor.service.RainfallEventDetector;
import com.sandy.debrisflow.monitor.service.WeatherIngestionService;
import com.sandy.debrisflow.monitor.vo.IngestionReport;
import com.sandy.debrisflow.monitor.vo.ObservationPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class RainfallEventDetectorTest {

    @Autowired StoreCleaner storeCleaner;
    @Autowired WeatherIngestionService ingestionService;
    @Autowired RainfallEventDetector detector;
    @Autowired RainfallEventRepository eventRepository;
    @Autowired MonitoredLocationRepository locationRepository;
    @Autowired AlertRepository alertRepository;

    LocalDateTime t0;

    @BeforeEach
    void setup() {
        storeCleaner.clean();
        t0 = LocalDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.HOURS).minusDays(2);
    }

    private static ObservationPayload obs(LocalDateTime ts, double rainMm, double intensity) {
        return ObservationPayload.builder()
                .timestamp(ts).longitude(10.0).latitude(46.0)
                .rainfallMm(rainMm).intensityMmHr(intensity)
                .source("test-station")
                .build();
    }

    private void ingest(ObservationPayload... records) {
        IngestionReport report = ingestionService.ingest(List.of(records));
        assertEquals(records.length, report.getAccepted(), () -> "rejections: " + report.getRejections());
        assertEquals(0, report.getProcessingFailures());
    }

    private List<RainfallEvent> events() {
        Long locationId = locationRepository.findAll().get(0).getId();
        List<RainfallEvent> list = eventRepository.findByLocationIdOrderByStartTimeDesc(locationId);
        return list.stream().sorted(Comparator.comparing(RainfallEvent::getStartTime)).toList();
    }

    @Test
    void steadyRainOpensEventWhenRollingTotalReachesOnset() {
        ingest(obs(t0.plusHours(1), 5, 5), obs(t0.plusHours(2), 5, 5), obs(t0.plusHours(3), 5, 5));

        List<RainfallEvent> events = events();
        assertEquals(1, events.size());
        RainfallEvent e = events.get(0);
        assertEquals(t0.plusHours(2), e.getStartTime());
        assertTrue(e.isActive());
        assertEquals(10.0, e.getTotalRainfallMm(), 1e-9);
        assertEquals(2, e.getObservationCount());

        assertEquals(1, detector.closeInactiveEvents(t0.plusHours(5)));
        RainfallEvent closed = eventRepository.findById(e.getId()).orElseThrow();
        assertFalse(closed.isActive());
        assertEquals(t0.plusHours(3), closed.getEndTime());
        assertEquals(60, closed.getDurationMinutes());
        assertTrue(closed.isThresholdExceeded());

        List<Alert> thresholdAlerts = alertRepository.findAll().stream()
                .filter(a -> a.getAlertType() == AlertType.THRESHOLD_EXCEEDED).toList();
        assertEquals(1, thresholdAlerts.size());
        assertEquals(e.getId(), thresholdAlerts.get(0).getRelatedEventId());
    }

    @Test
    void observationJustInsideGapExtendsEvent() {
        LocalDateTime second = t0.plusHours(2).minusMinutes(1);
        ingest(obs(t0, 12, 12), obs(second, 3, 3));

        List<RainfallEvent> events = events();
        assertEquals(1, events.size());
        assertTrue(events.get(0).isActive());
        assertEquals(2, events.get(0).getObservationCount());
        assertEquals(15.0, events.get(0).getTotalRainfallMm(), 1e-9);
        assertEquals(7.5, events.get(0).getAvgIntensityMmHr(), 1e-9);
        assertEquals(12.0, events.get(0).getMaxIntensityMmHr(), 1e-9);
    }

    @Test
    void observationExactlyAtGapClosesEventAndStartsAnother() {
        LocalDateTime last = t0.plusMinutes(30);
        LocalDateTime atGap = last.plusHours(2);
        ingest(obs(t0, 12, 12), obs(last, 2, 2), obs(atGap, 11, 11));

        List<RainfallEvent> events = events();
        assertEquals(2, events.size());
        assertFalse(events.get(0).isActive());
        assertEquals(last, events.get(0).getEndTime());
        assertTrue(events.get(1).isActive());
        assertEquals(atGap, events.get(1).getStartTime());
        assertEquals(1, eventRepository.countByLocationIdAndActiveTrue(events.get(1).getLocationId()));
    }

    @Test
    void dryObservationDoesNotExtendEvent() {
        ingest(obs(t0, 12, 12), obs(t0.plusHours(1), 0, 0));
        RainfallEvent e = events().get(0);
        assertTrue(e.isActive());
        assertEquals(t0, e.getLastObservationAt());
        assertEquals(1, e.getObservationCount());

        // a dry reading after the gap closes the event without opening a new one
        ingest(obs(t0.plusHours(3), 0, 0));
        List<RainfallEvent> events = events();
        assertEquals(1, events.size());
        assertFalse(events.get(0).isActive());
    }

    @Test
    void sweepRespectsExactGapBoundary() {
        ingest(obs(t0, 15, 15));
        LocalDateTime last = t0;
        assertEquals(0, detector.closeInactiveEvents(last.plusHours(2).minusSeconds(1)));
        assertTrue(events().get(0).isActive());
        assertEquals(1, detector.closeInactiveEvents(last.plusHours(2)));
        assertFalse(events().get(0).isActive());
        assertEquals(0, detector.closeInactiveEvents(last.plusHours(5)));
    }

    @Test
    void lightRainBelowOnsetOpensNothing() {
        ingest(obs(t0, 1, 1), obs(t0.plusHours(1), 1, 1), obs(t0.plusHours(2), 1, 1));
        assertTrue(events().isEmpty());
    }

    @Test
    void intenseBurstMarksThresholdImmediately() {
        ingest(obs(t0, 8, 25));
        RainfallEvent e = events().get(0);
        assertTrue(e.isThresholdExceeded());
        assertNotNull(e.getRiskLevel());
        assertNotNull(e.getRiskValue());
        assertTrue(e.getRiskValue() >= 0 && e.getRiskValue() <= 1);
        // no source areas registered
        assertTrue(e.isDegraded());
    }
}
