package com.sensor.anomaly.model;

public enum AlertState {
    NEW,
    ONGOING,
    CLEARED
}
