package com.sensor.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
@Schema(description = "Alert emitted by the decision state machine")
public class AlertEvent {

    @Schema(description = "Unique event identifier", example = "8f14e45f-ceea-467e-9a7b-2b1c2b3f9a10")
    String eventId;

    @Schema(description = "Record that caused the transition", example = "mq2_data-000000001042")
    String recordId;

    @Schema(description = "Entity the alert belongs to", example = "MQ2-01")
    String entityId;

    @Schema(description = "State transition", example = "NEW")
    AlertState state;

    @Schema(description = "Normalized anomaly score of the record", example = "0.83")
    double score;

    @Schema(description = "Threshold that was crossed: high for NEW/ONGOING, low for CLEARED", example = "0.7")
    double threshold;

    @Schema(description = "Profile z-score corroboration", example = "4.2")
    double deviationScore;

    @Schema(description = "Model version that produced the score", example = "4")
    long modelVersionId;

    @With
    @Schema(description = "Per-feature contribution to the score, present on NEW and ONGOING")
    Map<String, Double> contributions;

    @Schema(description = "Emission timestamp in epoch milliseconds", example = "1760800000000")
    long emittedAt;
}
