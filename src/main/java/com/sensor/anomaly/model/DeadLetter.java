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
@Schema(description = "Alert event that exhausted its delivery retries")
public class DeadLetter {

    private AlertEvent event;

    @Schema(description = "Transport that failed", example = "twilio")
    private String transport;

    private int attempts;

    @Schema(description = "Message of the last delivery failure")
    private String lastError;

    private long failedAt;
}
