package com.sandy.debrisflow.monitor.entity;

/** Why a simulation run was dispatched. */
public enum TriggerType {
    MANUAL, THRESHOLD_EXCEEDED, SCHEDULED
}
