package com.sensor.anomaly.engine.profile;

import com.sensor.anomaly.model.FeatureStatistics;
import com.sensor.anomaly.model.QuantileSketch;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable per-feature accumulator. Mean and variance use Welford's update, which is exact
 * and numerically stable without keeping history; quantiles come from P² sketches.
 * Not thread-safe: the profiler serializes access.
 */
final class RunningStatistics {

    private final String name;
    private final List<P2QuantileEstimator> quantiles;
    private long count;
    private double mean;
    private double m2;
    private double min;
    private double max;

    RunningStatistics(String name, List<Double> probabilities) {
        this.name = name;
        this.quantiles = new ArrayList<>(probabilities.size());
        for (double p : probabilities) {
            quantiles.add(new P2QuantileEstimator(p));
        }
    }

    static RunningStatistics restore(FeatureStatistics stats) {
        RunningStatistics running = new RunningStatistics(stats.getName(), List.of());
        running.count = stats.getCount();
        running.mean = stats.getMean();
        running.m2 = stats.getM2();
        running.min = stats.getMin();
        running.max = stats.getMax();
        for (QuantileSketch sketch : stats.getQuantiles()) {
            running.quantiles.add(P2QuantileEstimator.fromSketch(sketch));
        }
        return running;
    }

    void observe(double x) {
        count++;
        double delta = x - mean;
        mean += delta / count;
        m2 = Math.max(0.0, m2 + delta * (x - mean));
        if (count == 1) {
            min = x;
            max = x;
        } else {
            if (x < min) min = x;
            if (x > max) max = x;
        }
        for (P2QuantileEstimator estimator : quantiles) {
            estimator.add(x);
        }
    }

    void reset() {
        count = 0;
        mean = 0.0;
        m2 = 0.0;
        min = 0.0;
        max = 0.0;
        quantiles.forEach(P2QuantileEstimator::reset);
    }

    String name() {
        return name;
    }

    FeatureStatistics snapshot() {
        FeatureStatistics.FeatureStatisticsBuilder builder = FeatureStatistics.builder()
                .name(name)
                .count(count)
                .mean(mean)
                .m2(m2)
                .min(min)
                .max(max);
        for (P2QuantileEstimator estimator : quantiles) {
            builder.quantile(estimator.snapshot());
        }
        return builder.build();
    }
}
