package com.sandy.debrisflow.monitor.controller;

import com.sandy.debrisflow.monitor.service.WeatherIngestionService;
import com.sandy.debrisflow.monitor.vo.IngestionReport;
import com.sandy.debrisflow.monitor.vo.ObservationPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Weather feed entry point. Rejected records are reported in the response, never raised as alerts.
 */
@RestController
@RequestMapping("/api/observations")
@RequiredArgsConstructor
public class ObservationController {

    private final WeatherIngestionService ingestionService;

    @PostMapping
    public IngestionReport ingest(@RequestBody List<ObservationPayload> batch) {
        return ingestionService.ingest(batch);
    }
}
