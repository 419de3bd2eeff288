package com.sandy.debrisflow.monitor.service;

import com.sandy.debrisflow.monitor.entity.WeatherObservation;
import com.sandy.debrisflow.monitor.repository.WeatherObservationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps 1h / 24h / 7d rolling rainfall sums per monitored location and the latest committed
 * observation timestamp. State is rebuilt lazily from the observation store the first time a
 * location is touched after start-up.
 * <p>
 * Callers must serialize access per location (see {@link LocationWorkerPool}).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RainfallAggregator {

    private final WeatherObservationRepository observationRepository;

    private final Map<Long, LocationState> states = new ConcurrentHashMap<>();

    private static final class LocationState {
        private final Map<WindowSpan, SlidingRainfallWindow> windows = new EnumMap<>(WindowSpan.class);
        private LocalDateTime latestTimestamp;

        LocationState() {
            for (WindowSpan span : WindowSpan.values()) {
                windows.put(span, new SlidingRainfallWindow(span.duration()));
            }
        }

        void add(LocalDateTime ts, double rainfallMm) {
            for (SlidingRainfallWindow w : windows.values()) {
                w.add(ts, rainfallMm);
            }
            latestTimestamp = ts;
        }
    }

    /** Latest committed observation timestamp, if any. */
    public Optional<LocalDateTime> latestTimestamp(Long locationId) {
        return Optional.ofNullable(state(locationId).latestTimestamp);
    }

    /**
     * Incorporates a committed observation. Observations older than the latest committed one are refused.
     */
    public RainfallWindows add(WeatherObservation observation) {
        LocationState st = state(observation.getLocationId());
        LocalDateTime ts = observation.getTimestamp();
        if (st.latestTimestamp != null && !ts.isAfter(st.latestTimestamp)) {
            throw new IllegalStateException("Observation at " + ts + " is not after latest " + st.latestTimestamp
                    + " for location " + observation.getLocationId());
        }
        st.add(ts, observation.getRainfallMm());
        return snapshot(observation.getLocationId(), ts);
    }

    public RainfallWindows snapshot(Long locationId, LocalDateTime asOf) {
        LocationState st = state(locationId);
        return new RainfallWindows(locationId, asOf,
                st.windows.get(WindowSpan.ONE_HOUR).sum(asOf),
                st.windows.get(WindowSpan.ONE_DAY).sum(asOf),
                st.windows.get(WindowSpan.SEVEN_DAYS).sum(asOf));
    }

    /** Forgets all in-memory state; the next access rebuilds it from the store. */
    public void clear() {
        states.clear();
    }

    private LocationState state(Long locationId) {
        return states.computeIfAbsent(locationId, this::hydrate);
    }

    private LocationState hydrate(Long locationId) {
        LocationState st = new LocationState();
        Optional<WeatherObservation> latest = observationRepository.findTopByLocationIdOrderByTimestampDesc(locationId);
        if (latest.isEmpty()) {
            return st;
        }
        LocalDateTime from = latest.get().getTimestamp().minus(WindowSpan.SEVEN_DAYS.duration());
        List<WeatherObservation> history = observationRepository.findByLocationIdAndTimestampAfterOrderByTimestampAsc(locationId, from);
        for (WeatherObservation o : history) {
            st.add(o.getTimestamp(), o.getRainfallMm());
        }
        st.latestTimestamp = latest.get().getTimestamp();
        log.info("Rainfall windows hydrated locationId={} observations={} latest={}", locationId, history.size(), st.latestTimestamp);
        return st;
    }
}
