package com.sensor.anomaly.exception;

/**
 * Base type for every failure the detection engine reports.
 * All subclasses are unchecked: callers on the ingestion path isolate them per record.
 */
public abstract class AnomalyEngineException extends RuntimeException {

    protected AnomalyEngineException(String message) {
        super(message);
    }

    protected AnomalyEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
