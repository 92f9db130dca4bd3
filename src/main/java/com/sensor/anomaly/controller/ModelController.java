package com.sensor.anomaly.controller;

import com.sensor.anomaly.model.ModelVersion;
import com.sensor.anomaly.service.IsolationModelManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/models")
@Tag(name = "Models", description = "Isolation forest versions, retraining and rollback")
public class ModelController {

    private final IsolationModelManager modelManager;

    public ModelController(IsolationModelManager modelManager) {
        this.modelManager = modelManager;
    }

    @GetMapping("/current")
    @Operation(summary = "Get the active model version",
               description = "Metadata of the version used for scoring. 404 until the first training completes.")
    public ResponseEntity<ModelVersion.ModelSummary> getCurrent() {
        return modelManager.current()
                .map(model -> ResponseEntity.ok(model.summary()))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping
    @Operation(summary = "List retained prior versions",
               description = "Versions available for rollback, most recent first")
    public ResponseEntity<List<ModelVersion.ModelSummary>> getHistory() {
        return ResponseEntity.ok(modelManager.getHistory());
    }

    @PostMapping("/retrain")
    @Operation(summary = "Retrain now",
               description = "Trains a new version from the buffered samples and publishes it. " +
                       "Returns 409 when too few samples are buffered or a run is already in progress.")
    public ResponseEntity<ModelVersion.ModelSummary> retrain() {
        return ResponseEntity.ok(modelManager.retrain("manual").summary());
    }

    @PostMapping("/retrain/cancel")
    @Operation(summary = "Cancel the running training",
               description = "Stops at the next tree boundary; the active version is unchanged")
    public ResponseEntity<Map<String, Object>> cancel() {
        return ResponseEntity.ok(Map.of("cancelled", modelManager.cancel()));
    }

    @PostMapping("/rollback")
    @Operation(summary = "Roll back to the previous version",
               description = "Re-activates the most recent retained version. 409 when none is retained.")
    public ResponseEntity<?> rollback() {
        return modelManager.rollback()
                .<ResponseEntity<?>>map(model -> ResponseEntity.ok(model.summary()))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.CONFLICT)
                        .body(Map.of("error", "No prior model version retained")));
    }
}
