package com.sensor.anomaly.engine.profile;

import com.sensor.anomaly.config.ProfileConfig;
import com.sensor.anomaly.exception.FeatureShapeMismatchException;
import com.sensor.anomaly.exception.SchemaMismatchException;
import com.sensor.anomaly.model.FeatureSchema;
import com.sensor.anomaly.model.FeatureStatistics;
import com.sensor.anomaly.model.FeatureVector;
import com.sensor.anomaly.model.ProfileState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Streaming per-feature profile of "normal" data.
 *
 * <p>Single writer: {@link #observe} takes the write lock, so updates are applied one
 * vector at a time in call order. {@link #snapshot} takes the read lock and returns a deep
 * immutable copy, so readers never see a half-applied vector.
 *
 * <p>Statistics are never reset automatically; {@link #reset} exists for an operator to
 * acknowledge a legitimate distribution shift.
 */
@Component
public class HistoricalProfiler {

    private static final Logger log = LoggerFactory.getLogger(HistoricalProfiler.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<String> featureNames;
    private final List<RunningStatistics> statistics;

    public HistoricalProfiler(FeatureSchema schema, ProfileConfig config) {
        this.featureNames = schema.getNames();
        List<Double> probabilities = List.copyOf(config.getQuantiles());
        this.statistics = new ArrayList<>(featureNames.size());
        for (String name : featureNames) {
            statistics.add(new RunningStatistics(name, probabilities));
        }
    }

    public void observe(FeatureVector vector) {
        if (vector.dimensions() != statistics.size()) {
            throw new FeatureShapeMismatchException(statistics.size(), vector.dimensions());
        }
        lock.writeLock().lock();
        try {
            for (int i = 0; i < statistics.size(); i++) {
                statistics.get(i).observe(vector.get(i));
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public ProfileState snapshot() {
        lock.readLock().lock();
        try {
            ProfileState.ProfileStateBuilder builder = ProfileState.builder()
                    .capturedAt(System.currentTimeMillis());
            for (RunningStatistics running : statistics) {
                builder.feature(running.snapshot());
            }
            return builder.build();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Reset the named features. An empty collection resets every feature.
     *
     * @return names of the features that were reset
     */
    public List<String> reset(Collection<String> features) {
        List<String> targets = features == null || features.isEmpty() ? featureNames : List.copyOf(features);
        for (String name : targets) {
            if (!featureNames.contains(name)) {
                throw new SchemaMismatchException("Unknown feature: " + name);
            }
        }

        lock.writeLock().lock();
        try {
            for (RunningStatistics running : statistics) {
                if (targets.contains(running.name())) {
                    running.reset();
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.warn("Profile statistics reset for features {} (manual drift acknowledgement)", targets);
        return targets;
    }

    /**
     * Replace the live statistics with a persisted snapshot. The snapshot must describe the
     * same features, in the same order, as the configured schema.
     */
    public void restore(ProfileState state) {
        if (!state.getFeatureNames().equals(featureNames)) {
            throw new SchemaMismatchException("Persisted profile features " + state.getFeatureNames()
                    + " do not match schema " + featureNames);
        }
        lock.writeLock().lock();
        try {
            for (int i = 0; i < statistics.size(); i++) {
                FeatureStatistics persisted = state.get(i);
                statistics.set(i, RunningStatistics.restore(persisted));
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Restored profile for {} features ({} observations on {})",
                featureNames.size(), state.get(0).getCount(), featureNames.get(0));
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }
}
