package com.sandy.debrisflow.monitor.controller;

import com.sandy.debrisflow.monitor.entity.Alert;
import com.sandy.debrisflow.monitor.entity.AlertSeverity;
import com.sandy.debrisflow.monitor.entity.AlertType;
import com.sandy.debrisflow.monitor.exception.ResourceNotFoundException;
import com.sandy.debrisflow.monitor.repository.AlertRepository;
import com.sandy.debrisflow.monitor.service.AlertManager;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Alert feed and operator acknowledgement. Acknowledgement is one-way.
 */
@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
@Slf4j
public class AlertController {

    private final AlertRepository alertRepository;
    private final AlertManager alertManager;
    private final Clock clock;

    @GetMapping
    public List<AlertItem> listActive() {
        return alertRepository.findByAcknowledgedFalseOrderByCreatedAtDesc()
                .stream().map(this::toItem).collect(Collectors.toList());
    }

    @GetMapping("/recent")
    public List<AlertItem> listRecent() {
        return alertRepository.findTop50ByOrderByCreatedAtDesc().stream().map(this::toItem).collect(Collectors.toList());
    }

    @GetMapping("/stats")
    public Stats stats() {
        Stats s = new Stats();
        List<Alert> active = alertRepository.findByAcknowledgedFalseOrderByCreatedAtDesc();
        s.setActiveCount(active.size());
        LocalDateTime now = LocalDateTime.now(clock);
        List<Alert> recent = alertRepository.findByCreatedAtAfterOrderByCreatedAtAsc(now.minusHours(24));
        s.setRecent24hCount(recent.size());
        s.setSeverityActive(countBySeverity(active));
        s.setSeverityRecent24h(countBySeverity(recent));
        s.setTypeActive(countByType(active));
        // hour buckets, last 12 hours including the current one
        Map<String, Integer> hourMap = new LinkedHashMap<>();
        for (int i = 11; i >= 0; i--) {
            LocalDateTime start = now.minusHours(i).withMinute(0).withSecond(0).withNano(0);
            hourMap.put(String.format("%02d:00", start.getHour()), 0);
        }
        for (Alert a : recent) {
            LocalDateTime ts = a.getCreatedAt();
            if (ts == null || ts.isBefore(now.minusHours(12))) continue;
            hourMap.computeIfPresent(String.format("%02d:00", ts.getHour()), (k, v) -> v + 1);
        }
        s.setHourStats(hourMap.entrySet().stream().map(e -> {
            HourStat h = new HourStat();
            h.setHour(e.getKey());
            h.setCount(e.getValue());
            return h;
        }).collect(Collectors.toList()));
        return s;
    }

    private Map<String, Integer> countBySeverity(List<Alert> alerts) {
        Map<String, Integer> map = new LinkedHashMap<>();
        for (AlertSeverity sev : AlertSeverity.values()) {
            map.put(sev.name(), 0);
        }
        for (Alert a : alerts) {
            map.merge(a.getSeverity().name(), 1, Integer::sum);
        }
        return map;
    }

    private Map<String, Integer> countByType(List<Alert> alerts) {
        Map<String, Integer> map = new LinkedHashMap<>();
        for (AlertType type : AlertType.values()) {
            map.put(type.name(), 0);
        }
        for (Alert a : alerts) {
            map.merge(a.getAlertType().name(), 1, Integer::sum);
        }
        return map;
    }

    @PostMapping("/{id}/ack")
    public ResponseEntity<ActionResp> acknowledge(@PathVariable Long id, @RequestParam(required = false) String operator) {
        try {
            alertManager.acknowledge(id, operator);
        } catch (ResourceNotFoundException e) {
            return ResponseEntity.ok(ActionResp.fail("Alert not found"));
        }
        return ResponseEntity.ok(ActionResp.ok());
    }

    @GetMapping("/meta")
    public Meta meta() {
        Meta m = new Meta();
        m.setEnabled(alertManager.isEnabled());
        m.setActiveCount(alertRepository.findByAcknowledgedFalseOrderByCreatedAtDesc().size());
        return m;
    }

    @PostMapping("/batch-ack")
    public ResponseEntity<BatchActionResp> batchAcknowledge(@RequestBody BatchActionReq req) {
        List<Long> failed = new ArrayList<>();
        int success = 0;
        for (Long id : Optional.ofNullable(req.getIds()).orElse(List.of())) {
            try {
                alertManager.acknowledge(id, req.getOperator());
                success++;
            } catch (ResourceNotFoundException e) {
                failed.add(id);
            }
        }
        BatchActionResp resp = new BatchActionResp();
        resp.setSuccessCount(success);
        resp.setFailedIds(failed);
        return ResponseEntity.ok(resp);
    }

    private AlertItem toItem(Alert a) {
        AlertItem it = new AlertItem();
        it.setId(a.getId());
        it.setType(a.getAlertType());
        it.setSeverity(a.getSeverity());
        it.setTitle(a.getTitle());
        it.setMessage(a.getMessage());
        it.setRelatedSimulationId(a.getRelatedSimulationId());
        it.setRelatedEventId(a.getRelatedEventId());
        it.setRelatedLocationId(a.getRelatedLocationId());
        it.setRelatedChangeDetectionId(a.getRelatedChangeDetectionId());
        it.setOccurrenceCount(a.getOccurrenceCount());
        it.setCreatedAt(a.getCreatedAt());
        it.setLastSeenAt(a.getLastSeenAt());
        it.setAcknowledged(a.isAcknowledged());
        it.setAcknowledgedAt(a.getAcknowledgedAt());
        it.setAcknowledgedBy(a.getAcknowledgedBy());
        return it;
    }

    @Data
    public static class AlertItem {
        private Long id;
        private AlertType type;
        private AlertSeverity severity;
        private String title;
        private String message;
        private Long relatedSimulationId;
        private Long relatedEventId;
        private Long relatedLocationId;
        private Long relatedChangeDetectionId;
        private int occurrenceCount;
        private LocalDateTime createdAt;
        private LocalDateTime lastSeenAt;
        private boolean acknowledged;
        private LocalDateTime acknowledgedAt;
        private String acknowledgedBy;
    }

    @Data
    public static class ActionResp {
        private boolean success;
        private String message;
        public static ActionResp ok() { ActionResp r = new ActionResp(); r.success = true; return r; }
        public static ActionResp fail(String msg) { ActionResp r = new ActionResp(); r.success = false; r.message = msg; return r; }
    }

    @Data
    public static class Meta {
        private boolean enabled;
        private int activeCount;
    }

    @Data
    public static class HourStat { private String hour; private int count; }

    @Data
    public static class Stats {
        private int activeCount;
        private int recent24hCount;
        private Map<String, Integer> severityActive;
        private Map<String, Integer> severityRecent24h;
        private Map<String, Integer> typeActive;
        private List<HourStat> hourStats;
    }

    @Data
    public static class BatchActionReq {
        private List<Long> ids;
        private String operator;
    }

    @Data
    public static class BatchActionResp {
        private int successCount;
        private List<Long> failedIds;
    }
}
