package com.sandy.debrisflow.monitor.service;

import com.sandy.debrisflow.monitor.exception.ValidationException;
import com.sandy.debrisflow.monitor.vo.ObservationPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Stateless checks on a single feed record. Ordering against already committed observations is
 * checked separately on the location's worker.
 */
@Component
@RequiredArgsConstructor
public class ObservationValidator {

    private final Clock clock;

    @Value("${ingestion.max-future-skew:PT5M}")
    private Duration maxFutureSkew;

    public void validate(ObservationPayload p) {
        if (p == null) throw new ValidationException("record is null");
        if (p.getTimestamp() == null) throw new ValidationException("timestamp is missing");
        if (p.getLongitude() == null || p.getLatitude() == null) throw new ValidationException("location is missing");
        if (p.getSource() == null || p.getSource().isBlank()) throw new ValidationException("source is missing");
        if (p.getRainfallMm() == null && p.getIntensityMmHr() == null) {
            throw new ValidationException("rainfall_mm and intensity_mm_hr are both missing");
        }
        requireFinite("longitude", p.getLongitude());
        requireFinite("latitude", p.getLatitude());
        requireFinite("rainfall_mm", p.getRainfallMm());
        requireFinite("intensity_mm_hr", p.getIntensityMmHr());
        requireFinite("temperature_c", p.getTemperatureC());
        requireFinite("humidity_pct", p.getHumidityPct());
        requireFinite("wind_speed_ms", p.getWindSpeedMs());
        if (p.getLongitude() < -180 || p.getLongitude() > 180) throw new ValidationException("longitude out of range: " + p.getLongitude());
        if (p.getLatitude() < -90 || p.getLatitude() > 90) throw new ValidationException("latitude out of range: " + p.getLatitude());
        if (p.getRainfallMm() != null && p.getRainfallMm() < 0) throw new ValidationException("negative rainfall_mm: " + p.getRainfallMm());
        if (p.getIntensityMmHr() != null && p.getIntensityMmHr() < 0) throw new ValidationException("negative intensity_mm_hr: " + p.getIntensityMmHr());
        if (p.getHumidityPct() != null && (p.getHumidityPct() < 0 || p.getHumidityPct() > 100)) {
            throw new ValidationException("humidity_pct out of range: " + p.getHumidityPct());
        }
        if (p.getWindSpeedMs() != null && p.getWindSpeedMs() < 0) throw new ValidationException("negative wind_speed_ms: " + p.getWindSpeedMs());
        LocalDateTime latestAllowed = LocalDateTime.now(clock).plus(maxFutureSkew);
        if (p.getTimestamp().isAfter(latestAllowed)) {
            throw new ValidationException("timestamp " + p.getTimestamp() + " is in the future");
        }
    }

    private static void requireFinite(String field, Double v) {
        if (v != null && (v.isNaN() || v.isInfinite())) {
            throw new ValidationException(field + " is not a finite number");
        }
    }
}
