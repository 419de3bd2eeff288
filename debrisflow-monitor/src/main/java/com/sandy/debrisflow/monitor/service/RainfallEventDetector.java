package com.sandy.debrisflow.monitor.service;

import com.sandy.debrisflow.monitor.entity.RainfallEvent;
import com.sandy.debrisflow.monitor.entity.WeatherObservation;
import com.sandy.debrisflow.monitor.event.ObservationAcceptedEvent;
import com.sandy.debrisflow.monitor.event.RainfallEventClosedEvent;
import com.sandy.debrisflow.monitor.event.RainfallEventOpenedEvent;
import com.sandy.debrisflow.monitor.exception.HazardMonitorException;
import com.sandy.debrisflow.monitor.repository.RainfallEventRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Per-location Idle/Active state machine that debounces the observation stream into rainfall events.
 * The state is the presence of an active {@link RainfallEvent} row for the location. All work for a
 * location runs on that location's worker thread.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RainfallEventDetector {

    private final RainfallEventRepository eventRepository;
    private final RainfallAggregator aggregator;
    private final LocationWorkerPool workerPool;
    private final HazardAssessmentService hazardAssessmentService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Value("${detector.min-qualifying-intensity-mm-hr:0.1}")
    private double minQualifyingIntensity;
    @Value("${detector.onset-intensity-mm-hr:10}")
    private double onsetIntensity;
    @Value("${detector.onset-rainfall-mm:10}")
    private double onsetRainfallMm;
    @Value("${detector.onset-window:ONE_DAY}")
    private WindowSpan onsetWindow;
    @Value("${detector.trigger-intensity-mm-hr:20}")
    private double triggerIntensity;
    @Value("${detector.trigger-rainfall-mm:15}")
    private double triggerRainfallMm;
    @Value("${detector.inactivity-gap:PT2H}")
    private Duration inactivityGap;
    @Value("${detector.sweep.enabled:true}")
    private boolean sweepEnabled;

    @PostConstruct
    public void init() {
        log.info("Rainfall event detector initialized: onsetIntensity={} onsetRainfall={} over {} triggerIntensity={} triggerRainfall={} gap={}",
                onsetIntensity, onsetRainfallMm, onsetWindow, triggerIntensity, triggerRainfallMm, inactivityGap);
    }

    @EventListener
    public void onObservationAccepted(ObservationAcceptedEvent accepted) {
        WeatherObservation obs = accepted.observation();
        RainfallWindows windows = accepted.windows();
        Long locationId = obs.getLocationId();
        LocalDateTime t = obs.getTimestamp();

        RainfallEvent active = eventRepository.findByLocationIdAndActiveTrue(locationId).orElse(null);
        if (active != null && gapElapsed(active, t)) {
            close(active, windows);
            active = null;
        }
        if (!qualifies(obs)) {
            return;
        }
        if (active != null) {
            extend(active, obs, windows);
        } else if (isOnset(obs, windows)) {
            open(obs, windows);
        }
    }

    @Scheduled(fixedDelayString = "${detector.sweep.interval-ms:60000}")
    public void scheduledSweep() {
        if (!sweepEnabled) return;
        try {
            closeInactiveEvents(LocalDateTime.now(clock));
        } catch (Exception e) {
            log.error("Scheduled inactivity sweep failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Closes every active event whose last qualifying observation is at least the inactivity gap
     * before {@code now}. Each location is handled on its own worker.
     *
     * @return number of events closed
     */
    public int closeInactiveEvents(LocalDateTime now) {
        List<Future<Boolean>> futures = new ArrayList<>();
        for (RainfallEvent candidate : eventRepository.findByActiveTrueOrderByStartTimeDesc()) {
            Long locationId = candidate.getLocationId();
            futures.add(workerPool.submit(locationId, () -> {
                Optional<RainfallEvent> current = eventRepository.findByLocationIdAndActiveTrue(locationId);
                if (current.isEmpty() || !gapElapsed(current.get(), now)) {
                    return false;
                }
                close(current.get(), aggregator.snapshot(locationId, now));
                return true;
            }));
        }
        int closed = 0;
        for (Future<Boolean> f : futures) {
            try {
                if (Boolean.TRUE.equals(f.get())) closed++;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new HazardMonitorException("Interrupted during inactivity sweep", e);
            } catch (ExecutionException e) {
                log.error("Failed to close inactive event", e.getCause());
            }
        }
        if (closed > 0) {
            log.info("Inactivity sweep closed {} event(s) at {}", closed, now);
        }
        return closed;
    }

    boolean qualifies(WeatherObservation obs) {
        return obs.getRainfallMm() > 0 || obs.getIntensityMmHr() >= minQualifyingIntensity;
    }

    boolean isOnset(WeatherObservation obs, RainfallWindows windows) {
        return obs.getIntensityMmHr() >= onsetIntensity || windows.sum(onsetWindow) >= onsetRainfallMm;
    }

    private boolean exceedsTrigger(WeatherObservation obs, RainfallWindows windows) {
        return obs.getIntensityMmHr() >= triggerIntensity || windows.sum(onsetWindow) >= triggerRainfallMm;
    }

    // elapsed strictly below the gap keeps the event open
    private boolean gapElapsed(RainfallEvent event, LocalDateTime t) {
        return Duration.between(event.getLastObservationAt(), t).compareTo(inactivityGap) >= 0;
    }

    private void open(WeatherObservation obs, RainfallWindows windows) {
        RainfallEvent event = RainfallEvent.builder()
                .locationId(obs.getLocationId())
                .startTime(obs.getTimestamp())
                .durationMinutes(0)
                .totalRainfallMm(obs.getRainfallMm())
                .maxIntensityMmHr(obs.getIntensityMmHr())
                .avgIntensityMmHr(obs.getIntensityMmHr())
                .observationCount(1)
                .lastObservationAt(obs.getTimestamp())
                .thresholdExceeded(exceedsTrigger(obs, windows))
                .active(true)
                .createdAt(LocalDateTime.now(clock))
                .build();
        event = eventRepository.save(event);
        log.info("Rainfall event opened id={} locationId={} start={} thresholdExceeded={}",
                event.getId(), event.getLocationId(), event.getStartTime(), event.isThresholdExceeded());
        eventPublisher.publishEvent(new RainfallEventOpenedEvent(event.getId(), event.getLocationId(), event.getStartTime()));
        hazardAssessmentService.assess(event, windows);
    }

    private void extend(RainfallEvent event, WeatherObservation obs, RainfallWindows windows) {
        int n = event.getObservationCount();
        event.setTotalRainfallMm(event.getTotalRainfallMm() + obs.getRainfallMm());
        event.setMaxIntensityMmHr(Math.max(event.getMaxIntensityMmHr(), obs.getIntensityMmHr()));
        event.setAvgIntensityMmHr((event.getAvgIntensityMmHr() * n + obs.getIntensityMmHr()) / (n + 1));
        event.setObservationCount(n + 1);
        event.setLastObservationAt(obs.getTimestamp());
        event.setDurationMinutes((int) Duration.between(event.getStartTime(), obs.getTimestamp()).toMinutes());
        if (!event.isThresholdExceeded() && exceedsTrigger(obs, windows)) {
            event.setThresholdExceeded(true);
            log.info("Rainfall event id={} exceeded trigger threshold at {}", event.getId(), obs.getTimestamp());
        }
        RainfallEvent saved = eventRepository.save(event);
        log.debug("Rainfall event extended id={} total={} max={} count={}",
                saved.getId(), saved.getTotalRainfallMm(), saved.getMaxIntensityMmHr(), saved.getObservationCount());
        hazardAssessmentService.assess(saved, windows);
    }

    private void close(RainfallEvent event, RainfallWindows windows) {
        event.setEndTime(event.getLastObservationAt());
        event.setDurationMinutes((int) Duration.between(event.getStartTime(), event.getEndTime()).toMinutes());
        event.setActive(false);
        RainfallEvent saved = hazardAssessmentService.assess(eventRepository.save(event), windows);
        log.info("Rainfall event closed id={} locationId={} start={} end={} total={} max={} thresholdExceeded={}",
                saved.getId(), saved.getLocationId(), saved.getStartTime(), saved.getEndTime(),
                saved.getTotalRainfallMm(), saved.getMaxIntensityMmHr(), saved.isThresholdExceeded());
        eventPublisher.publishEvent(new RainfallEventClosedEvent(saved.getId(), saved.getLocationId(),
                saved.getStartTime(), saved.getEndTime(), saved.getTotalRainfallMm(),
                saved.getMaxIntensityMmHr(), saved.isThresholdExceeded()));
    }
}
