package com.sandy.debrisflow.monitor.service.impl;

import com.sandy.debrisflow.monitor.entity.MonitoredLocation;
import com.sandy.debrisflow.monitor.entity.WeatherObservation;
import com.sandy.debrisflow.monitor.event.ObservationAcceptedEvent;
import com.sandy.debrisflow.monitor.exception.HazardMonitorException;
import com.sandy.debrisflow.monitor.exception.ValidationException;
import com.sandy.debrisflow.monitor.service.LocationRegistry;
import com.sandy.debrisflow.monitor.service.LocationWorkerPool;
import com.sandy.debrisflow.monitor.service.ObservationStore;
import com.sandy.debrisflow.monitor.service.ObservationValidator;
import com.sandy.debrisflow.monitor.service.RainfallAggregator;
import com.sandy.debrisflow.monitor.service.RainfallWindows;
import com.sandy.debrisflow.monitor.service.WeatherIngestionService;
import com.sandy.debrisflow.monitor.vo.IngestionReport;
import com.sandy.debrisflow.monitor.vo.ObservationPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Validates a feed batch, groups it by monitored location and hands each group to that location's
 * worker, where ordering checks, persistence, window aggregation and event detection happen in
 * sequence. The call returns once every group has been processed.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WeatherIngestionServiceImpl implements WeatherIngestionService {

    private final ObservationValidator validator;
    private final LocationRegistry locationRegistry;
    private final LocationWorkerPool workerPool;
    private final ObservationStore observationStore;
    private final RainfallAggregator aggregator;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private record Indexed(int index, ObservationPayload payload) {}

    @Override
    public IngestionReport ingest(List<ObservationPayload> batch) {
        IngestionReport report = new IngestionReport();
        if (batch == null || batch.isEmpty()) {
            return report;
        }
        report.setReceived(batch.size());

        Map<Long, List<Indexed>> byLocation = new LinkedHashMap<>();
        for (int i = 0; i < batch.size(); i++) {
            ObservationPayload p = batch.get(i);
            try {
                validator.validate(p);
            } catch (ValidationException e) {
                log.warn("Rejected observation index={} reason={}", i, e.getMessage());
                report.reject(i, e.getMessage());
                continue;
            }
            MonitoredLocation location = locationRegistry.resolve(p.getLongitude(), p.getLatitude());
            byLocation.computeIfAbsent(location.getId(), k -> new ArrayList<>()).add(new Indexed(i, p));
        }

        List<Future<?>> futures = new ArrayList<>();
        for (Map.Entry<Long, List<Indexed>> e : byLocation.entrySet()) {
            Long locationId = e.getKey();
            List<Indexed> records = e.getValue();
            futures.add(workerPool.submit(locationId, () -> {
                for (Indexed r : records) {
                    ingestOne(locationId, r, report);
                }
                return null;
            }));
        }
        for (Future<?> f : futures) {
            try {
                f.get();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new HazardMonitorException("Interrupted while waiting for ingestion workers", ie);
            } catch (ExecutionException ee) {
                throw new HazardMonitorException("Ingestion worker failed", ee.getCause());
            }
        }
        log.info("Ingestion batch done: received={} accepted={} rejected={} processingFailures={}",
                report.getReceived(), report.getAccepted(), report.getRejected(), report.getProcessingFailures());
        return report;
    }

    // runs on the location's worker thread
    private void ingestOne(Long locationId, Indexed r, IngestionReport report) {
        ObservationPayload p = r.payload();
        Optional<LocalDateTime> latest = aggregator.latestTimestamp(locationId);
        if (latest.isPresent() && !p.getTimestamp().isAfter(latest.get())) {
            String reason = p.getTimestamp().isEqual(latest.get())
                    ? "duplicate timestamp " + p.getTimestamp()
                    : "out-of-order timestamp " + p.getTimestamp() + " (latest " + latest.get() + ")";
            log.warn("Rejected observation index={} locationId={} reason={}", r.index(), locationId, reason);
            report.reject(r.index(), reason);
            return;
        }

        WeatherObservation stored;
        try {
            stored = observationStore.append(toObservation(locationId, p));
        } catch (DataAccessException e) {
            log.error("Observation not stored index={} locationId={} error={}", r.index(), locationId, e.getMessage());
            report.reject(r.index(), "store unavailable: " + e.getMessage());
            return;
        }
        report.accept();

        RainfallWindows windows = aggregator.add(stored);
        log.debug("Observation accepted locationId={} ts={} rain={} intensity={} 1h={} 24h={} 7d={}",
                locationId, stored.getTimestamp(), stored.getRainfallMm(), stored.getIntensityMmHr(),
                windows.oneHourMm(), windows.oneDayMm(), windows.sevenDayMm());
        try {
            eventPublisher.publishEvent(new ObservationAcceptedEvent(stored, windows));
        } catch (RuntimeException e) {
            // state transitions are not retried; the observation itself is committed
            log.error("Event processing failed for observation id={} locationId={}", stored.getId(), locationId, e);
            report.processingFailed();
        }
    }

    private WeatherObservation toObservation(Long locationId, ObservationPayload p) {
        return WeatherObservation.builder()
                .locationId(locationId)
                .timestamp(p.getTimestamp())
                .longitude(p.getLongitude())
                .latitude(p.getLatitude())
                .rainfallMm(p.getRainfallMm() != null ? p.getRainfallMm() : 0.0)
                .intensityMmHr(p.getIntensityMmHr() != null ? p.getIntensityMmHr() : 0.0)
                .temperatureC(p.getTemperatureC())
                .humidityPct(p.getHumidityPct())
                .windSpeedMs(p.getWindSpeedMs())
                .source(p.getSource())
                .createdAt(LocalDateTime.now(clock))
                .build();
    }
}
