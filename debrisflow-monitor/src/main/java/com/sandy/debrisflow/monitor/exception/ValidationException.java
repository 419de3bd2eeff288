package com.sandy.debrisflow.monitor.exception;

/**
 * Malformed, out-of-order or out-of-range input. Rejected at the boundary and never persisted.
 */
public class ValidationException extends HazardMonitorException {
    public ValidationException(String message) {
        super(message);
    }
}
