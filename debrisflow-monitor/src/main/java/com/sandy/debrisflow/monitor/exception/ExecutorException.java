package com.sandy.debrisflow.monitor.exception;

/**
 * The external simulation executor rejected, lost or failed a request.
 */
public class ExecutorException extends HazardMonitorException {
    public ExecutorException(String message) {
        super(message);
    }

    public ExecutorException(String message, Throwable cause) {
        super(message, cause);
    }
}
