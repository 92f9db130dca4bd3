package com.sensor.anomaly.controller;

import com.sensor.anomaly.model.ProcessingResult;
import com.sensor.anomaly.model.RawRecord;
import com.sensor.anomaly.service.DetectionPipeline;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/records")
@Tag(name = "Records", description = "Push sensor records through the detection pipeline")
public class RecordController {

    private final DetectionPipeline pipeline;

    public RecordController(DetectionPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @PostMapping("/score")
    @Operation(summary = "Score a single record",
               description = "Extracts features, scores against the active model, updates the profile and " +
                       "applies the alert state machine. Rejected records come back with status REJECTED and a reason.")
    public ResponseEntity<ProcessingResult> score(@RequestBody RawRecord record) {
        return ResponseEntity.ok(pipeline.process(record));
    }

    @PostMapping("/batch")
    @Operation(summary = "Score a batch of records",
               description = "Processes records in order. A bad record is reported as rejected and never aborts the batch.")
    public ResponseEntity<DetectionPipeline.BatchSummary> scoreBatch(@RequestBody List<RawRecord> records) {
        return ResponseEntity.ok(pipeline.processBatch(records));
    }
}
