package com.sensor.anomaly.exception;

/**
 * An alert transport failed to deliver an event.
 */
public class DispatchFailureException extends AnomalyEngineException {

    public DispatchFailureException(String message) {
        super(message);
    }

    public DispatchFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
