package com.sensor.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "ingestion")
public class IngestionConfig {

    private boolean enabled = true;

    // Key under which the cursor is persisted
    private String sourceName = "mq2_data";

    private int batchSize = 50;

    private long pollIntervalMs = 1000;

    // Backoff after an IngestionFailure: initial * multiplier^(failures-1), capped
    private long initialBackoffMs = 1000;
    private double backoffMultiplier = 2.0;
    private long maxBackoffMs = 60000;

    private Simulator simulator = new Simulator();

    /**
     * Synthetic MQ2 gas-sensor feed: mostly normal readings, a small share of spikes and
     * flatlines.
     */
    @Data
    public static class Simulator {
        private String sensorId = "MQ2-01";
        private String feature = "sensor_value";
        private double mean = 150.0;
        private double stdDev = 25.0;
        private double anomalyRate = 0.05;
        private double spikeValue = 900.0;
        private double flatlineValue = 0.0;
        private long intervalMs = 1000;
        private Long seed;
    }
}
