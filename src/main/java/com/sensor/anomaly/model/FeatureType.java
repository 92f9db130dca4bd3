package com.sensor.anomaly.model;

public enum FeatureType {
    DOUBLE,
    LONG,
    INTEGER,
    BOOLEAN
}
