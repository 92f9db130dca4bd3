package com.sensor.anomaly.exception;

/**
 * No model version has been published yet. Expected during startup; records are treated as unscored.
 */
public class ModelUnavailableException extends AnomalyEngineException {

    public ModelUnavailableException(String message) {
        super(message);
    }
}
