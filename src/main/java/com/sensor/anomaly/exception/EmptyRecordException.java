package com.sensor.anomaly.exception;

public class EmptyRecordException extends AnomalyEngineException {

    public EmptyRecordException(String message) {
        super(message);
    }
}
