package com.sensor.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A raw row pulled from the monitored data source")
public class RawRecord {

    @Schema(description = "Unique record identifier", example = "mq2_data-000000001042")
    private String recordId;

    @Schema(description = "Logical entity the record belongs to, used for per-entity alert hysteresis", example = "MQ2-01")
    private String entityId;

    @Schema(description = "Ingestion timestamp in epoch milliseconds", example = "1760800000000")
    private long timestamp;

    @Schema(description = "Column name to raw value", example = "{\"sensor_value\": 152.4}")
    @Builder.Default
    private Map<String, Object> values = new HashMap<>();
}
