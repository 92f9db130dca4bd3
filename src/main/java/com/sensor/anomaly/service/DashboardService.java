package com.sensor.anomaly.service;

import com.sensor.anomaly.config.DetectionConfig;
import com.sensor.anomaly.model.AnomalyScore;
import com.sensor.anomaly.model.FeatureVector;
import io.swagger.v3.oas.annotations.media.Schema;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters and the most recent anomalies for the monitoring dashboard.
 * A scored record counts as invalid when its score reaches the high threshold.
 */
@Service
public class DashboardService {

    private final DetectionConfig config;

    private final AtomicLong total = new AtomicLong();
    private final AtomicLong valid = new AtomicLong();
    private final AtomicLong invalid = new AtomicLong();
    private final AtomicLong unprocessed = new AtomicLong();
    private final Deque<AnomalyEntry> recentAnomalies = new ArrayDeque<>();

    public DashboardService(DetectionConfig config) {
        this.config = config;
    }

    public void recordScored(FeatureVector vector, AnomalyScore score) {
        total.incrementAndGet();
        if (score.getNormalizedScore() < config.getThresholdHigh()) {
            valid.incrementAndGet();
            return;
        }
        invalid.incrementAndGet();

        Map<String, Double> values = new LinkedHashMap<>();
        for (int i = 0; i < vector.dimensions(); i++) {
            values.put(vector.getNames().get(i), vector.get(i));
        }
        AnomalyEntry entry = new AnomalyEntry(vector.getRecordId(), vector.getEntityId(),
                vector.getTimestamp(), values, score.getNormalizedScore());
        synchronized (recentAnomalies) {
            recentAnomalies.addFirst(entry);
            while (recentAnomalies.size() > config.getRecentAnomalyLimit()) {
                recentAnomalies.pollLast();
            }
        }
    }

    // Unscored and rejected records
    public void recordUnprocessed() {
        total.incrementAndGet();
        unprocessed.incrementAndGet();
    }

    public DashboardData getDashboardData() {
        List<AnomalyEntry> anomalies;
        synchronized (recentAnomalies) {
            anomalies = new ArrayList<>(recentAnomalies);
        }
        return new DashboardData(
                new DashboardStats(total.get(), valid.get(), invalid.get(), unprocessed.get()),
                anomalies);
    }

    @Schema(description = "Record counters since startup")
    public record DashboardStats(long total, long valid, long invalid, long unprocessed) {}

    @Schema(description = "A recent anomalous record")
    public record AnomalyEntry(String recordId, String entityId, long timestamp,
                               Map<String, Double> values, double score) {}

    @Schema(description = "Counters and the latest anomalies, newest first")
    public record DashboardData(DashboardStats stats, List<AnomalyEntry> anomalies) {}
}
