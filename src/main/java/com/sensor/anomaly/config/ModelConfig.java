package com.sensor.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "model")
public class ModelConfig {

    // T: number of isolation trees per version
    private int treeCount = 50;

    // ψ: records drawn (without replacement) per tree
    private int subSampleSize = 256;

    // Below this many buffered samples retraining fails with InsufficientData
    private int minTrainingSamples = 256;

    // Prior versions kept for diagnostics and rollback
    private int retainedVersions = 3;

    // Ring buffer of recent feature vectors used as the training pool
    private int sampleBufferCapacity = 2048;

    // Fixed seed for reproducible training; null draws a fresh seed per run
    private Long seed;

    private Retraining retraining = new Retraining();

    @Data
    public static class Retraining {
        private boolean enabled = true;
        private int intervalMinutes = 15;
        // Samples observed since the last training that force a retrain
        private long sampleThreshold = 1000;
        // Allowed shift of the mean normalized score away from the post-publish baseline
        private double driftBound = 0.1;
        // Scores used to establish the baseline, and the recent window compared against it
        private int driftWindow = 200;
        private int checkIntervalSeconds = 10;
    }
}
