package com.sensor.anomaly.exception;

/**
 * The sample buffer holds fewer records than the configured training minimum.
 */
public class InsufficientDataException extends AnomalyEngineException {

    private final int available;
    private final int required;

    public InsufficientDataException(int available, int required) {
        super(String.format("Insufficient training data: %d buffered samples, %d required", available, required));
        this.available = available;
        this.required = required;
    }

    public int getAvailable() { return available; }
    public int getRequired() { return required; }
}
