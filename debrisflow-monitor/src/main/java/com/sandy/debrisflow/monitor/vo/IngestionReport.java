package com.sandy.debrisflow.monitor.vo;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one ingestion batch. Rejected records are reported here only, never raised as alerts.
 */
@Data
public class IngestionReport {
    private int received;
    private int accepted;
    private int rejected;
    /** Accepted and stored, but a downstream state transition failed. */
    private int processingFailures;
    private List<Rejection> rejections = new ArrayList<>();

    @Data
    public static class Rejection {
        private int index;
        private String reason;

        public static Rejection of(int index, String reason) {
            Rejection r = new Rejection();
            r.index = index;
            r.reason = reason;
            return r;
        }
    }

    public synchronized void reject(int index, String reason) {
        rejected++;
        rejections.add(Rejection.of(index, reason));
    }

    public synchronized void accept() {
        accepted++;
    }

    public synchronized void processingFailed() {
        processingFailures++;
    }
}
