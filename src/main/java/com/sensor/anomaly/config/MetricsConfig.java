package com.sensor.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicLong activeModelVersion;
    private final AtomicInteger alertingEntities;
    private final AtomicInteger sampleBufferSize;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.activeModelVersion = registry.gauge("model.active.version", new AtomicLong(0));
        this.alertingEntities = registry.gauge("alerts.entities.alerting", new AtomicInteger(0));
        this.sampleBufferSize = registry.gauge("model.sample_buffer.size", new AtomicInteger(0));
    }

    public void recordScored(double normalizedScore) {
        Counter.builder("records.processed.count")
                .tag("status", "scored")
                .register(registry)
                .increment();

        DistributionSummary.builder("records.anomaly_score")
                .register(registry)
                .record(normalizedScore);
    }

    public void recordUnscored() {
        Counter.builder("records.processed.count")
                .tag("status", "unscored")
                .register(registry)
                .increment();
    }

    public void recordRejected(String reason) {
        Counter.builder("records.processed.count")
                .tag("status", "rejected")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordAlert(String state) {
        Counter.builder("alerts.emitted.count")
                .tag("state", state)
                .register(registry)
                .increment();
    }

    public void recordDispatch(String transport, String status) {
        Counter.builder("alerts.dispatch.count")
                .tag("transport", transport)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordRetrain(String outcome) {
        Counter.builder("model.retrain.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordIngestionFailure() {
        Counter.builder("ingestion.failure.count")
                .register(registry)
                .increment();
    }

    public void updateActiveModelVersion(long versionId) {
        activeModelVersion.set(versionId);
    }

    public void updateAlertingEntities(int count) {
        alertingEntities.set(count);
    }

    public void updateSampleBufferSize(int size) {
        sampleBufferSize.set(size);
    }
}
