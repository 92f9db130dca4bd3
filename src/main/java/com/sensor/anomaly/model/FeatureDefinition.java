package com.sensor.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Declared feature: name, expected type and validation bounds")
public class FeatureDefinition {

    @Schema(description = "Column name in the raw record", example = "sensor_value")
    private String name;

    @Schema(description = "Expected value type", example = "DOUBLE")
    @Builder.Default
    private FeatureType type = FeatureType.DOUBLE;

    @Schema(description = "Whether the record must carry this feature", example = "true")
    @Builder.Default
    private boolean required = true;

    @Schema(description = "Inclusive lower bound, null for unbounded", example = "0.0")
    private Double min;

    @Schema(description = "Inclusive upper bound, null for unbounded", example = "10000.0")
    private Double max;

    // Imputed when the feature is optional, absent, and the profile has no observations yet
    @Schema(description = "Fallback imputation value", example = "0.0")
    @Builder.Default
    private double defaultValue = 0.0;
}
