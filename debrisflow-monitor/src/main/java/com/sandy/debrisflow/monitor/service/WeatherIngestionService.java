package com.sandy.debrisflow.monitor.service;

import com.sandy.debrisflow.monitor.vo.IngestionReport;
import com.sandy.debrisflow.monitor.vo.ObservationPayload;

import java.util.List;

public interface WeatherIngestionService {
    IngestionReport ingest(List<ObservationPayload> batch);
}
