package com.sensor.anomaly.service;

/**
 * Detects a shift of the score distribution under one model version. The first
 * {@code window} scores after publication form the baseline; afterwards a sliding window of
 * the latest {@code window} scores is compared against it.
 */
class ScoreDriftMonitor {

    private final int window;
    private final double bound;
    private final double[] recent;

    private int baselineCount;
    private double baselineSum;
    private int recentCount;
    private int recentHead;
    private double recentSum;

    ScoreDriftMonitor(int window, double bound) {
        this.window = Math.max(1, window);
        this.bound = bound;
        this.recent = new double[this.window];
    }

    synchronized void record(double score) {
        if (baselineCount < window) {
            baselineCount++;
            baselineSum += score;
            return;
        }
        if (recentCount == window) {
            recentSum -= recent[recentHead];
        } else {
            recentCount++;
        }
        recent[recentHead] = score;
        recentSum += score;
        recentHead = (recentHead + 1) % window;
    }

    synchronized boolean isDrifted() {
        if (recentCount < window) {
            return false;
        }
        return Math.abs(recentSum / recentCount - baselineSum / baselineCount) > bound;
    }

    synchronized double shift() {
        if (recentCount == 0 || baselineCount == 0) {
            return 0.0;
        }
        return recentSum / recentCount - baselineSum / baselineCount;
    }

    synchronized void reset() {
        baselineCount = 0;
        baselineSum = 0.0;
        recentCount = 0;
        recentHead = 0;
        recentSum = 0.0;
    }
}
