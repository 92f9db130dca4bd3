package com.sensor.anomaly.service;

import com.aerospike.client.AerospikeException;
import com.sensor.anomaly.config.IngestionConfig;
import com.sensor.anomaly.config.MetricsConfig;
import com.sensor.anomaly.exception.IngestionFailureException;
import com.sensor.anomaly.ingestion.IngestionSource;
import com.sensor.anomaly.model.IngestionBatch;
import com.sensor.anomaly.repository.CursorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Polls the ingestion source and feeds the detection pipeline.
 *
 * <p>The cursor only advances after the whole batch has been processed, so a crash replays
 * at most one batch. A fetch failure leaves the cursor where it was and backs off
 * exponentially before the next attempt.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final IngestionSource source;
    private final CursorRepository cursorRepository;
    private final DetectionPipeline pipeline;
    private final IngestionConfig config;
    private final MetricsConfig metricsConfig;

    private String cursor;
    private boolean cursorLoaded;
    private int consecutiveFailures;
    private long nextAttemptAt;

    public IngestionService(IngestionSource source,
                            CursorRepository cursorRepository,
                            DetectionPipeline pipeline,
                            IngestionConfig config,
                            MetricsConfig metricsConfig) {
        this.source = source;
        this.cursorRepository = cursorRepository;
        this.pipeline = pipeline;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @Scheduled(fixedDelayString = "${ingestion.poll-interval-ms:1000}")
    public void scheduledPoll() {
        if (config.isEnabled()) {
            poll(System.currentTimeMillis());
        }
    }

    /**
     * One poll cycle.
     *
     * @return number of records processed, 0 while backing off or on failure
     */
    public synchronized int poll(long now) {
        if (now < nextAttemptAt) {
            return 0;
        }

        IngestionBatch batch;
        try {
            if (!cursorLoaded) {
                cursor = cursorRepository.findCursor(source.name());
                cursorLoaded = true;
                log.info("Ingestion from '{}' resumes at cursor {}", source.name(), cursor);
            }
            batch = source.fetchBatch(cursor);
        } catch (IngestionFailureException | AerospikeException e) {
            onFailure(now, e);
            return 0;
        }

        if (consecutiveFailures > 0) {
            log.info("Ingestion from '{}' recovered after {} failures", source.name(), consecutiveFailures);
        }
        consecutiveFailures = 0;
        nextAttemptAt = 0;

        if (batch.records().isEmpty()) {
            return 0;
        }
        pipeline.processBatch(batch.records());

        cursor = batch.nextCursor();
        try {
            cursorRepository.saveCursor(source.name(), cursor);
        } catch (AerospikeException e) {
            // In-memory cursor still advances; a restart replays from the last saved one
            log.error("Failed to persist cursor {} for '{}': {}", cursor, source.name(), e.getMessage());
        }
        return batch.records().size();
    }

    private void onFailure(long now, Exception e) {
        consecutiveFailures++;
        long delay = backoffDelay(consecutiveFailures);
        nextAttemptAt = now + delay;
        metricsConfig.recordIngestionFailure();
        log.warn("Ingestion from '{}' failed ({} in a row), retrying in {} ms: {}",
                source.name(), consecutiveFailures, delay, e.getMessage());
    }

    long backoffDelay(int failures) {
        double delay = config.getInitialBackoffMs() * Math.pow(config.getBackoffMultiplier(), failures - 1);
        return (long) Math.min(delay, config.getMaxBackoffMs());
    }

    public synchronized String getCursor() {
        return cursor;
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }
}
