package com.sensor.anomaly.exception;

/**
 * The ingestion source could not return a batch.
 */
public class IngestionFailureException extends AnomalyEngineException {

    public IngestionFailureException(String message) {
        super(message);
    }

    public IngestionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
