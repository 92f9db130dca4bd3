package com.sensor.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;

/**
 * Frozen state of a P² quantile estimator for one target probability: five marker
 * heights, their actual positions (1-based) and desired positions. While fewer than five
 * values have been observed, {@code heights[0..count)} holds the raw observations.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class QuantileSketch {

    public static final int MARKERS = 5;

    private final double probability;
    private final long count;
    private final double[] heights;
    private final int[] positions;
    private final double[] desired;

    @JsonCreator
    public QuantileSketch(@JsonProperty("probability") double probability,
                          @JsonProperty("count") long count,
                          @JsonProperty("heights") double[] heights,
                          @JsonProperty("positions") int[] positions,
                          @JsonProperty("desired") double[] desired) {
        if (heights.length != MARKERS || positions.length != MARKERS || desired.length != MARKERS) {
            throw new IllegalArgumentException("Quantile sketch requires " + MARKERS + " markers");
        }
        this.probability = probability;
        this.count = count;
        this.heights = Arrays.copyOf(heights, MARKERS);
        this.positions = Arrays.copyOf(positions, MARKERS);
        this.desired = Arrays.copyOf(desired, MARKERS);
    }

    public double getProbability() { return probability; }
    public long getCount() { return count; }
    public double[] getHeights() { return Arrays.copyOf(heights, MARKERS); }
    public int[] getPositions() { return Arrays.copyOf(positions, MARKERS); }
    public double[] getDesired() { return Arrays.copyOf(desired, MARKERS); }

    /**
     * Current estimate of the quantile, or NaN when nothing has been observed.
     */
    public double estimate() {
        if (count == 0) {
            return Double.NaN;
        }
        if (count < MARKERS) {
            double[] seen = Arrays.copyOf(heights, (int) count);
            Arrays.sort(seen);
            return seen[(int) Math.round(probability * (count - 1))];
        }
        return heights[2];
    }
}
