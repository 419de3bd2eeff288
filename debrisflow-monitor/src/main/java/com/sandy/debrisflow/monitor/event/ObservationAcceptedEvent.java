package com.sandy.debrisflow.monitor.event;

import com.sandy.debrisflow.monitor.entity.WeatherObservation;
import com.sandy.debrisflow.monitor.service.RainfallWindows;

/**
 * Published on the location's worker thread after an observation is committed and aggregated.
 */
public record ObservationAcceptedEvent(WeatherObservation observation, RainfallWindows windows) {
    public Long locationId() {
        return observation.getLocationId();
    }
}
