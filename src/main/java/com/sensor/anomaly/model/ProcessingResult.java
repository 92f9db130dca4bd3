package com.sensor.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Outcome of pushing one record through the detection pipeline")
public class ProcessingResult {

    public enum Status {
        SCORED,
        // No model published yet: profile updated, record not scored
        UNSCORED,
        REJECTED
    }

    String recordId;

    Status status;

    AnomalyScore score;

    @Schema(description = "Alert emitted for this record, if any")
    AlertEvent alert;

    @Schema(description = "Why the record was rejected", example = "Feature 'sensor_value' is below its minimum 0.0: -4.0")
    String reason;
}
