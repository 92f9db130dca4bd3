package com.sensor.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "Streaming statistics for a single feature")
public class FeatureStatistics {

    @Schema(description = "Feature name", example = "sensor_value")
    String name;

    @Schema(description = "Number of observations since the last reset", example = "1030")
    long count;

    @Schema(description = "Running mean (Welford)", example = "151.82")
    double mean;

    @Schema(description = "Welford's M2 accumulator: sum of squared deviations from the mean", example = "643210.5")
    double m2;

    @Schema(description = "Smallest observed value", example = "0.0")
    double min;

    @Schema(description = "Largest observed value", example = "900.0")
    double max;

    @Singular
    List<QuantileSketch> quantiles;

    /** Population variance; never negative. */
    public double getVariance() {
        return count > 0 ? Math.max(0.0, m2 / count) : 0.0;
    }

    public double getStdDev() {
        return Math.sqrt(getVariance());
    }

    public Map<String, Double> getQuantileEstimates() {
        Map<String, Double> estimates = new LinkedHashMap<>();
        if (count == 0) {
            return estimates;
        }
        for (QuantileSketch sketch : quantiles) {
            estimates.put("p" + formatProbability(sketch.getProbability()), sketch.estimate());
        }
        return estimates;
    }

    public double quantile(double probability) {
        for (QuantileSketch sketch : quantiles) {
            if (sketch.getProbability() == probability) {
                return sketch.estimate();
            }
        }
        throw new IllegalArgumentException("Quantile " + probability + " is not tracked for " + name);
    }

    private static String formatProbability(double p) {
        String digits = Double.toString(p * 100);
        return digits.endsWith(".0") ? digits.substring(0, digits.length() - 2) : digits;
    }
}
