package com.sandy.debrisflow.monitor.entity;

public enum AlertSeverity {
    INFO, WARNING, CRITICAL;

    public AlertSeverity max(AlertSeverity other) {
        return other != null && other.compareTo(this) > 0 ? other : this;
    }
}
