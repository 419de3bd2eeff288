package com.sandy.debrisflow.monitor.exception;

/**
 * Base type for failures the pipeline reports to its callers.
 */
public class HazardMonitorException extends RuntimeException {
    public HazardMonitorException(String message) {
        super(message);
    }

    public HazardMonitorException(String message, Throwable cause) {
        super(message, cause);
    }
}
