package com.sensor.anomaly.service;

import com.sensor.anomaly.config.MetricsConfig;
import com.sensor.anomaly.config.ModelConfig;
import com.sensor.anomaly.engine.isolationforest.IsolationForestTrainer;
import com.sensor.anomaly.engine.isolationforest.IsolationTree;
import com.sensor.anomaly.engine.isolationforest.SampleRingBuffer;
import com.sensor.anomaly.exception.InsufficientDataException;
import com.sensor.anomaly.exception.ModelUnavailableException;
import com.sensor.anomaly.model.AnomalyScore;
import com.sensor.anomaly.model.FeatureSchema;
import com.sensor.anomaly.model.FeatureVector;
import com.sensor.anomaly.model.ModelVersion;
import com.sensor.anomaly.repository.ModelVersionRepository;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the lifecycle of isolation-forest model versions.
 *
 * <p>The active version lives in a single {@link AtomicReference}. This manager is its only
 * writer; scoring reads it once per record and keeps that reference for the whole call, so a
 * publication mid-score is never observed.
 *
 * <p>Training draws from a point-in-time snapshot of the sample ring buffer on the
 * {@code retrainExecutor}, so it neither blocks nor is blocked by scoring. It can be
 * cancelled between trees; an aborted or failed run leaves the active version in place.
 *
 * <p>Retraining fires on whichever comes first:
 * <ol>
 *   <li>no model yet and enough buffered samples</li>
 *   <li>the configured interval since the last attempt</li>
 *   <li>the configured number of new samples since the last training</li>
 *   <li>score drift under the active version</li>
 *   <li>an explicit request</li>
 * </ol>
 */
@Service
public class IsolationModelManager {

    private static final Logger log = LoggerFactory.getLogger(IsolationModelManager.class);

    private final ModelConfig config;
    private final FeatureSchema schema;
    private final IsolationForestTrainer trainer;
    private final ModelVersionRepository modelRepository;
    private final MetricsConfig metricsConfig;
    private final TaskExecutor retrainExecutor;

    private final SampleRingBuffer<FeatureVector> sampleBuffer;
    private final ScoreDriftMonitor driftMonitor;

    private final AtomicReference<ModelVersion> current = new AtomicReference<>();
    private final Deque<ModelVersion> history = new ArrayDeque<>();
    private final AtomicLong versionSequence = new AtomicLong();
    private final AtomicLong samplesSinceTraining = new AtomicLong();
    private final AtomicBoolean training = new AtomicBoolean(false);
    private volatile boolean cancelRequested;
    private volatile long lastAttemptAt;

    // Spring proxy of this bean; internal calls through it are observed
    private IsolationModelManager self = this;

    public IsolationModelManager(ModelConfig config,
                                 FeatureSchema schema,
                                 IsolationForestTrainer trainer,
                                 ModelVersionRepository modelRepository,
                                 MetricsConfig metricsConfig,
                                 @Qualifier("retrainExecutor") TaskExecutor retrainExecutor) {
        this.config = config;
        this.schema = schema;
        this.trainer = trainer;
        this.modelRepository = modelRepository;
        this.metricsConfig = metricsConfig;
        this.retrainExecutor = retrainExecutor;
        this.sampleBuffer = new SampleRingBuffer<>(config.getSampleBufferCapacity());
        this.driftMonitor = new ScoreDriftMonitor(
                config.getRetraining().getDriftWindow(), config.getRetraining().getDriftBound());
        this.lastAttemptAt = System.currentTimeMillis();
    }

    @Autowired
    public void setSelf(@Lazy IsolationModelManager self) {
        this.self = self;
    }

    /**
     * Resume scoring with the persisted version, if one matches the configured schema.
     */
    @PostConstruct
    public void restore() {
        ModelVersion persisted = modelRepository.loadActive();
        if (persisted == null) {
            log.info("No persisted model version. Records stay unscored until the first training.");
            return;
        }
        if (!persisted.getFeatureNames().equals(schema.getNames())) {
            log.warn("Persisted model version {} was trained on {} but the schema is {}. Ignoring it.",
                    persisted.getVersionId(), persisted.getFeatureNames(), schema.getNames());
            return;
        }
        boolean corrupt = persisted.getTrees().stream()
                .anyMatch(tree -> tree.maxFeatureIndex() >= persisted.getDimensions());
        if (corrupt) {
            log.warn("Persisted model version {} splits on a feature outside its {} dimensions. Ignoring it.",
                    persisted.getVersionId(), persisted.getDimensions());
            return;
        }
        current.set(persisted);
        versionSequence.set(persisted.getVersionId());
        metricsConfig.updateActiveModelVersion(persisted.getVersionId());
        log.info("Restored model version {} ({} trees, {} nodes, trained at {})",
                persisted.getVersionId(), persisted.getTrees().size(),
                persisted.getTrees().stream().mapToInt(IsolationTree::nodeCount).sum(),
                persisted.getTrainedAt());
    }

    public Optional<ModelVersion> current() {
        return Optional.ofNullable(current.get());
    }

    public ModelVersion requireCurrent() {
        ModelVersion model = current.get();
        if (model == null) {
            throw new ModelUnavailableException("No model version has been trained yet");
        }
        return model;
    }

    public void addSample(FeatureVector vector) {
        sampleBuffer.add(vector);
        samplesSinceTraining.incrementAndGet();
        metricsConfig.updateSampleBufferSize(sampleBuffer.size());
    }

    /**
     * Feed a score into drift tracking. Scores computed against a superseded version are
     * ignored.
     */
    public void recordScore(AnomalyScore score) {
        ModelVersion model = current.get();
        if (model != null && model.getVersionId() == score.getModelVersionId()) {
            driftMonitor.record(score.getNormalizedScore());
        }
    }

    /**
     * Train and publish a new version synchronously on the calling thread.
     *
     * @throws InsufficientDataException if fewer than the minimum samples are buffered
     * @throws CancellationException     if {@link #cancel()} was called during training
     * @throws IllegalStateException     if another training run is in progress
     */
    @Observed(name = "model.retrain", contextualName = "retrain-isolation-forest")
    public ModelVersion retrain(String reason) {
        if (!training.compareAndSet(false, true)) {
            throw new IllegalStateException("A training run is already in progress");
        }
        cancelRequested = false;
        lastAttemptAt = System.currentTimeMillis();
        try {
            List<FeatureVector> samples = sampleBuffer.snapshot();
            if (samples.size() < config.getMinTrainingSamples()) {
                ModelVersion active = current.get();
                log.warn("Model is stale: cannot retrain ({}), {} buffered samples < minimum {}. Keeping version {}.",
                        reason, samples.size(), config.getMinTrainingSamples(),
                        active == null ? "none" : active.getVersionId());
                metricsConfig.recordRetrain("insufficient_data");
                throw new InsufficientDataException(samples.size(), config.getMinTrainingSamples());
            }

            double[][] data = new double[samples.size()][];
            for (int i = 0; i < data.length; i++) {
                data[i] = samples.get(i).toArray();
            }

            long versionId = versionSequence.incrementAndGet();
            long seed = config.getSeed() != null ? config.getSeed() + versionId : ThreadLocalRandom.current().nextLong();
            log.info("Training model version {} ({}): {} samples, {} trees, psi={}",
                    versionId, reason, data.length, config.getTreeCount(), config.getSubSampleSize());

            ModelVersion model = trainer.train(data, schema.getNames(), versionId,
                    config.getTreeCount(), config.getSubSampleSize(), seed, () -> cancelRequested);
            publish(model);
            metricsConfig.recordRetrain("published");
            return model;
        } catch (CancellationException e) {
            log.warn("Training cancelled ({}): {}. Active version unchanged.", reason, e.getMessage());
            metricsConfig.recordRetrain("cancelled");
            throw e;
        } finally {
            training.set(false);
        }
    }

    /**
     * Start a training run on the retrain executor.
     *
     * @return false if a run is already in progress
     */
    public boolean triggerRetrain(String reason) {
        if (training.get()) {
            return false;
        }
        try {
            retrainExecutor.execute(() -> {
                try {
                    self.retrain(reason);
                } catch (InsufficientDataException | CancellationException e) {
                    // logged and counted by retrain()
                } catch (IllegalStateException e) {
                    log.debug("Skipped retrain ({}): {}", reason, e.getMessage());
                } catch (RuntimeException e) {
                    metricsConfig.recordRetrain("failed");
                    log.error("Training failed ({}). Active version unchanged.", reason, e);
                }
            });
            return true;
        } catch (TaskRejectedException e) {
            return false;
        }
    }

    /**
     * Ask the running training to stop at the next tree boundary.
     *
     * @return false if nothing is training
     */
    public boolean cancel() {
        if (!training.get()) {
            return false;
        }
        cancelRequested = true;
        log.info("Cancellation requested for the running training");
        return true;
    }

    /**
     * Re-activate the most recent retained prior version; the replaced version is discarded.
     */
    public synchronized Optional<ModelVersion> rollback() {
        ModelVersion previous = history.pollFirst();
        if (previous == null) {
            return Optional.empty();
        }
        ModelVersion replaced = current.getAndSet(previous);
        driftMonitor.reset();
        metricsConfig.updateActiveModelVersion(previous.getVersionId());
        modelRepository.saveActive(previous);
        log.warn("Rolled back from model version {} to {}",
                replaced == null ? "none" : replaced.getVersionId(), previous.getVersionId());
        return Optional.of(previous);
    }

    private synchronized void publish(ModelVersion model) {
        ModelVersion previous = current.getAndSet(model);
        if (previous != null) {
            history.addFirst(previous);
            while (history.size() > config.getRetainedVersions()) {
                ModelVersion dropped = history.pollLast();
                log.debug("Discarded model version {}", dropped.getVersionId());
            }
        }
        samplesSinceTraining.set(0);
        driftMonitor.reset();
        metricsConfig.updateActiveModelVersion(model.getVersionId());
        log.info("Published model version {} (previous: {})",
                model.getVersionId(), previous == null ? "none" : previous.getVersionId());
        modelRepository.saveActive(model);
    }

    @Scheduled(fixedDelayString = "${model.retraining.check-interval-seconds:10}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "5")
    public void checkRetrainTriggers() {
        if (!config.getRetraining().isEnabled()) {
            return;
        }
        String reason = pendingTrigger(System.currentTimeMillis());
        if (reason != null && triggerRetrain(reason)) {
            log.info("Retraining triggered: {}", reason);
        }
    }

    /**
     * @return the first retraining trigger that has fired, or null
     */
    String pendingTrigger(long now) {
        ModelConfig.Retraining retraining = config.getRetraining();
        boolean enoughData = sampleBuffer.size() >= config.getMinTrainingSamples();

        if (current.get() == null) {
            return enoughData ? "initial" : null;
        }
        if (enoughData && driftMonitor.isDrifted()) {
            return String.format("score-drift %.3f", driftMonitor.shift());
        }
        if (enoughData && samplesSinceTraining.get() >= retraining.getSampleThreshold()) {
            return "sample-threshold";
        }
        if (now - lastAttemptAt >= TimeUnit.MINUTES.toMillis(retraining.getIntervalMinutes())) {
            return "interval";
        }
        return null;
    }

    public synchronized List<ModelVersion.ModelSummary> getHistory() {
        List<ModelVersion.ModelSummary> summaries = new ArrayList<>(history.size());
        history.forEach(model -> summaries.add(model.summary()));
        return summaries;
    }

    public boolean isTraining() {
        return training.get();
    }

    public int getBufferedSamples() {
        return sampleBuffer.size();
    }
}
