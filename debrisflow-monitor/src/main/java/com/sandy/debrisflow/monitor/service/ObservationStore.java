package com.sandy.debrisflow.monitor.service;

import com.sandy.debrisflow.monitor.entity.WeatherObservation;
import com.sandy.debrisflow.monitor.repository.WeatherObservationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

/**
 * Write path for observations. Transient store failures are retried with exponential backoff;
 * this is the only place in the pipeline where a write is retried.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ObservationStore {

    private final WeatherObservationRepository observationRepository;

    @Retryable(retryFor = TransientDataAccessException.class,
            maxAttemptsExpression = "${ingestion.store-retry.max-attempts:3}",
            backoff = @Backoff(delayExpression = "${ingestion.store-retry.delay-ms:200}", multiplier = 2))
    public WeatherObservation append(WeatherObservation observation) {
        return observationRepository.save(observation);
    }

    @Recover
    public WeatherObservation recover(TransientDataAccessException e, WeatherObservation observation) {
        log.error("Observation store unavailable after retries locationId={} ts={}",
                observation.getLocationId(), observation.getTimestamp(), e);
        throw e;
    }
}
