package com.sensor.anomaly.model;

import java.util.Arrays;
import java.util.List;

/**
 * Ordered named numeric fields extracted from one source record. Immutable: values are
 * copied in and out.
 */
public final class FeatureVector {

    private final String recordId;
    private final String entityId;
    private final long timestamp;
    private final List<String> names;
    private final double[] values;

    public FeatureVector(String recordId, String entityId, long timestamp,
                         List<String> names, double[] values) {
        if (names.size() != values.length) {
            throw new IllegalArgumentException(
                    "Feature names (" + names.size() + ") and values (" + values.length + ") differ in length");
        }
        this.recordId = recordId;
        this.entityId = entityId;
        this.timestamp = timestamp;
        this.names = List.copyOf(names);
        this.values = Arrays.copyOf(values, values.length);
    }

    public String getRecordId() { return recordId; }
    public String getEntityId() { return entityId; }
    public long getTimestamp() { return timestamp; }
    public List<String> getNames() { return names; }

    public int dimensions() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    public double[] toArray() {
        return Arrays.copyOf(values, values.length);
    }

    @Override
    public String toString() {
        return "FeatureVector{recordId=" + recordId + ", entityId=" + entityId
                + ", values=" + Arrays.toString(values) + "}";
    }
}
