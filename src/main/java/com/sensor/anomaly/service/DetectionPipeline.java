package com.sensor.anomaly.service;

import com.sensor.anomaly.config.MetricsConfig;
import com.sensor.anomaly.engine.decision.AlertDecisionEngine;
import com.sensor.anomaly.engine.features.FeatureExtractor;
import com.sensor.anomaly.engine.profile.HistoricalProfiler;
import com.sensor.anomaly.engine.scoring.Scorer;
import com.sensor.anomaly.exception.AnomalyEngineException;
import com.sensor.anomaly.exception.EmptyRecordException;
import com.sensor.anomaly.exception.FeatureShapeMismatchException;
import com.sensor.anomaly.exception.ModelUnavailableException;
import com.sensor.anomaly.exception.SchemaMismatchException;
import com.sensor.anomaly.model.AlertEvent;
import com.sensor.anomaly.model.AlertState;
import com.sensor.anomaly.model.AnomalyScore;
import com.sensor.anomaly.model.FeatureSchema;
import com.sensor.anomaly.model.FeatureVector;
import com.sensor.anomaly.model.ModelVersion;
import com.sensor.anomaly.model.ProcessingResult;
import com.sensor.anomaly.model.ProfileState;
import com.sensor.anomaly.model.RawRecord;
import io.micrometer.observation.annotation.Observed;
import io.swagger.v3.oas.annotations.media.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs one record through extraction, scoring, profiling and the alert decision.
 *
 * <p>The record is scored against the profile and model as they were before the record was
 * seen, then folded into the profile and the training sample buffer. Without a published
 * model the profile still learns and the record is reported as unscored.
 *
 * <p>Failures are isolated per record: a rejected record leaves the profile untouched and
 * never aborts a batch.
 */
@Service
public class DetectionPipeline {

    private static final Logger log = LoggerFactory.getLogger(DetectionPipeline.class);

    private final FeatureSchema schema;
    private final HistoricalProfiler profiler;
    private final IsolationModelManager modelManager;
    private final Scorer scorer;
    private final AlertDecisionEngine decisionEngine;
    private final AlertDispatchService dispatchService;
    private final DashboardService dashboardService;
    private final MetricsConfig metricsConfig;

    public DetectionPipeline(FeatureSchema schema,
                             HistoricalProfiler profiler,
                             IsolationModelManager modelManager,
                             Scorer scorer,
                             AlertDecisionEngine decisionEngine,
                             AlertDispatchService dispatchService,
                             DashboardService dashboardService,
                             MetricsConfig metricsConfig) {
        this.schema = schema;
        this.profiler = profiler;
        this.modelManager = modelManager;
        this.scorer = scorer;
        this.decisionEngine = decisionEngine;
        this.dispatchService = dispatchService;
        this.dashboardService = dashboardService;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "pipeline.process", contextualName = "process-record")
    public ProcessingResult process(RawRecord record) {
        String recordId = record == null ? null : record.getRecordId();
        ProfileState profile = profiler.snapshot();

        FeatureVector vector;
        try {
            vector = FeatureExtractor.extract(record, schema, profile);
        } catch (SchemaMismatchException | EmptyRecordException e) {
            return reject(recordId, e);
        }

        ModelVersion model = null;
        AnomalyScore score = null;
        try {
            model = modelManager.requireCurrent();
            score = scorer.score(vector, model, profile);
        } catch (ModelUnavailableException e) {
            log.debug("Record {} left unscored: {}", recordId, e.getMessage());
        } catch (FeatureShapeMismatchException e) {
            return reject(recordId, e);
        }

        profiler.observe(vector);
        modelManager.addSample(vector);

        if (score == null) {
            metricsConfig.recordUnscored();
            dashboardService.recordUnprocessed();
            return ProcessingResult.builder()
                    .recordId(recordId)
                    .status(ProcessingResult.Status.UNSCORED)
                    .build();
        }

        metricsConfig.recordScored(score.getNormalizedScore());
        modelManager.recordScore(score);
        dashboardService.recordScored(vector, score);

        Optional<AlertEvent> alert = decisionEngine.decide(score, vector.getTimestamp());
        if (alert.isPresent()) {
            AlertEvent event = alert.get();
            if (event.getState() != AlertState.CLEARED) {
                event = event.withContributions(scorer.explain(vector, model, profile));
            }
            metricsConfig.recordAlert(event.getState().name());
            metricsConfig.updateAlertingEntities(decisionEngine.alertingCount());
            log.info("Alert {} for entity={} record={} score={}",
                    event.getState(), event.getEntityId(), recordId, String.format("%.3f", event.getScore()));
            try {
                dispatchService.dispatch(event);
            } catch (TaskRejectedException e) {
                log.warn("Dispatch queue full, dead-lettering alert {} for entity={}",
                        event.getEventId(), event.getEntityId());
                dispatchService.deadLetterUndispatched(event, "Dispatch queue rejected the event: " + e.getMessage());
            }
            alert = Optional.of(event);
        }

        return ProcessingResult.builder()
                .recordId(recordId)
                .status(ProcessingResult.Status.SCORED)
                .score(score)
                .alert(alert.orElse(null))
                .build();
    }

    /**
     * Process records in order. A failing record is counted as rejected and the batch goes on.
     */
    @Observed(name = "pipeline.batch", contextualName = "process-batch")
    public BatchSummary processBatch(List<RawRecord> records) {
        List<ProcessingResult> results = new ArrayList<>(records.size());
        int scored = 0;
        int unscored = 0;
        int rejected = 0;
        int alerts = 0;

        for (RawRecord record : records) {
            ProcessingResult result;
            try {
                result = process(record);
            } catch (RuntimeException e) {
                log.error("Unexpected failure processing record {}", record == null ? null : record.getRecordId(), e);
                metricsConfig.recordRejected("internal");
                dashboardService.recordUnprocessed();
                result = ProcessingResult.builder()
                        .recordId(record == null ? null : record.getRecordId())
                        .status(ProcessingResult.Status.REJECTED)
                        .reason(e.getMessage())
                        .build();
            }
            results.add(result);
            switch (result.getStatus()) {
                case SCORED -> scored++;
                case UNSCORED -> unscored++;
                case REJECTED -> rejected++;
            }
            if (result.getAlert() != null) {
                alerts++;
            }
        }

        if (rejected > 0 || alerts > 0) {
            log.info("Processed batch of {}: {} scored, {} unscored, {} rejected, {} alerts",
                    records.size(), scored, unscored, rejected, alerts);
        }
        return new BatchSummary(records.size(), scored, unscored, rejected, alerts, results);
    }

    private ProcessingResult reject(String recordId, AnomalyEngineException e) {
        log.warn("Rejected record {}: {}", recordId, e.getMessage());
        metricsConfig.recordRejected(e.getClass().getSimpleName());
        dashboardService.recordUnprocessed();
        return ProcessingResult.builder()
                .recordId(recordId)
                .status(ProcessingResult.Status.REJECTED)
                .reason(e.getMessage())
                .build();
    }

    @Schema(description = "Per-status counts for a processed batch")
    public record BatchSummary(int total, int scored, int unscored, int rejected, int alerts,
                               List<ProcessingResult> results) {}
}
