package com.sandy.debrisflow.monitor.entity;

public enum AlertType {
    /** Risk level of an event rose above MODERATE. */
    HIGH_RISK,
    /** A simulation run failed on the executor or timed out. */
    SIMULATION_FAILED,
    /** A rainfall event closed after exceeding the trigger threshold. */
    THRESHOLD_EXCEEDED,
    /** A risk assessment fell back to default terrain inputs. */
    DEGRADED_ASSESSMENT,
    /** A change detection reported a large net volume change. */
    TERRAIN_CHANGE
}
