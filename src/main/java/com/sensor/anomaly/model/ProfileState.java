package com.sensor.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable point-in-time copy of the historical profile, one entry per schema feature in
 * schema order.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "Snapshot of the per-feature streaming statistics")
public class ProfileState {

    @Singular("feature")
    List<FeatureStatistics> features;

    @Schema(description = "Snapshot timestamp in epoch milliseconds", example = "1760800000000")
    long capturedAt;

    public int dimensions() {
        return features.size();
    }

    public FeatureStatistics get(int index) {
        return features.get(index);
    }

    public List<String> getFeatureNames() {
        return features.stream().map(FeatureStatistics::getName).collect(Collectors.toList());
    }
}
