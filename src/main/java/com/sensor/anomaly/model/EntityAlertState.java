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
@Schema(description = "Hysteresis state of one tracked entity")
public class EntityAlertState {

    public enum Status { NORMAL, ALERTING }

    @Schema(description = "Entity identifier", example = "MQ2-01")
    private String entityId;

    @Builder.Default
    private Status status = Status.NORMAL;

    @Schema(description = "Last record applied to this entity, used to drop redelivered records")
    private String lastRecordId;

    private long lastRecordAt;

    private long lastNotifiedAt;

    public EntityAlertState copy() {
        return new EntityAlertState(entityId, status, lastRecordId, lastRecordAt, lastNotifiedAt);
    }
}
