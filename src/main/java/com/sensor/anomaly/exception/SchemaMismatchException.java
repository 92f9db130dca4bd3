package com.sensor.anomaly.exception;

/**
 * A declared feature is missing, wrongly typed or out of its declared range.
 */
public class SchemaMismatchException extends AnomalyEngineException {

    public SchemaMismatchException(String message) {
        super(message);
    }
}
