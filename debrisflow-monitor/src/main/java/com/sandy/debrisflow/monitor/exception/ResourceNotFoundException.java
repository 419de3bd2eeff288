package com.sandy.debrisflow.monitor.exception;

public class ResourceNotFoundException extends HazardMonitorException {
    public ResourceNotFoundException(String kind, Object id) {
        super(kind + "[id=" + id + "] not found");
    }
}
