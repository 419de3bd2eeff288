package com.sandy.debrisflow.monitor.executor;

/**
 * Run status as reported by the external model executor.
 */
public enum ExecutorStatus {
    QUEUED, RUNNING, COMPLETED, FAILED, CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
