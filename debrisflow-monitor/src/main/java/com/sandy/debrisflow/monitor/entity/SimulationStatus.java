package com.sandy.debrisflow.monitor.entity;

/**
 * Simulation run lifecycle. COMPLETED and FAILED are terminal; nothing re-enters RUNNING.
 */
public enum SimulationStatus {
    PENDING, RUNNING, COMPLETED, FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean isInFlight() {
        return this == PENDING || this == RUNNING;
    }

    public boolean canTransitionTo(SimulationStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == FAILED;
            case RUNNING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
