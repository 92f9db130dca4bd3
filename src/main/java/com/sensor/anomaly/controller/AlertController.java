package com.sensor.anomaly.controller;

import com.sensor.anomaly.engine.decision.AlertDecisionEngine;
import com.sensor.anomaly.model.DeadLetter;
import com.sensor.anomaly.model.EntityAlertState;
import com.sensor.anomaly.service.AlertDispatchService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/alerts")
@Tag(name = "Alerts", description = "Per-entity alert state and undeliverable alerts")
public class AlertController {

    private final AlertDecisionEngine decisionEngine;
    private final AlertDispatchService dispatchService;

    public AlertController(AlertDecisionEngine decisionEngine, AlertDispatchService dispatchService) {
        this.decisionEngine = decisionEngine;
        this.dispatchService = dispatchService;
    }

    @GetMapping("/entities")
    @Operation(summary = "Get entity alert states",
               description = "NORMAL/ALERTING status with the last record and notification time per entity")
    public ResponseEntity<List<EntityAlertState>> getEntityStates() {
        return ResponseEntity.ok(decisionEngine.getEntityStates());
    }

    @GetMapping("/dead-letters")
    @Operation(summary = "Get dead-lettered alerts",
               description = "Alerts that exhausted their delivery retries, most recent first")
    public ResponseEntity<List<DeadLetter>> getDeadLetters(
            @Parameter(description = "Max entries", example = "50")
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(dispatchService.getDeadLetters(limit));
    }
}
