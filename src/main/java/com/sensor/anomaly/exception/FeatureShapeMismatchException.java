package com.sensor.anomaly.exception;

public class FeatureShapeMismatchException extends AnomalyEngineException {

    public FeatureShapeMismatchException(int expected, int actual) {
        super(String.format("Feature vector has %d features, expected %d", actual, expected));
    }
}
