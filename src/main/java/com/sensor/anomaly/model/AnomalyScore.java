package com.sensor.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "Isolation-forest score of one record")
public class AnomalyScore {

    @Schema(description = "Source record identifier", example = "mq2_data-000000001042")
    String recordId;

    @Schema(description = "Entity identifier", example = "MQ2-01")
    String entityId;

    @Schema(description = "Average isolation path length across all trees", example = "3.12")
    double rawScore;

    @Schema(description = "Normalized score 2^(-E(h)/c(psi)); ~1 anomalous, ~0.5 typical", example = "0.74")
    double normalizedScore;

    @Schema(description = "Largest absolute z-score of any feature against the profile", example = "3.8")
    double deviationScore;

    @Schema(description = "Model version used to compute the score", example = "4")
    long modelVersionId;
}
