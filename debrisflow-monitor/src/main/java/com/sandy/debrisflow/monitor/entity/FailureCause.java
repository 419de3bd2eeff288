package com.sandy.debrisflow.monitor.entity;

public enum FailureCause {
    EXECUTOR_ERROR, TIMEOUT, CANCELLED
}
