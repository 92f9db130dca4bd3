package com.sensor.anomaly.engine.isolationforest;

import com.sensor.anomaly.model.ModelVersion;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * Trains an isolation forest into an immutable {@link ModelVersion}.
 */
@Component
public class IsolationForestTrainer {

    /**
     * Train the isolation forest on the given data.
     *
     * @param data          training samples, each row is a feature vector
     * @param featureNames  names of the columns of {@code data}
     * @param versionId     id to stamp on the produced version
     * @param numTrees      number of trees in the forest
     * @param subSampleSize sub-sampling size per tree (capped at the number of rows)
     * @param seed          random seed for reproducibility
     * @param cancelled     polled before every tree; when it returns true training stops
     * @throws CancellationException if {@code cancelled} fired before the last tree was built
     */
    public ModelVersion train(double[][] data, List<String> featureNames, long versionId,
                              int numTrees, int subSampleSize, long seed, BooleanSupplier cancelled) {
        if (data.length < 2) {
            throw new IllegalArgumentException("At least two samples are required, got " + data.length);
        }
        if (numTrees < 1) {
            throw new IllegalArgumentException("numTrees must be positive");
        }
        int dimensions = featureNames.size();
        for (double[] row : data) {
            if (row.length != dimensions) {
                throw new IllegalArgumentException(
                        "Training row has " + row.length + " features, expected " + dimensions);
            }
        }

        int psi = Math.max(2, Math.min(subSampleSize, data.length));
        int maxDepth = PathLength.maxDepth(psi);
        Random random = new Random(seed);

        List<IsolationTree> trees = new ArrayList<>(numTrees);
        for (int i = 0; i < numTrees; i++) {
            if (cancelled.getAsBoolean()) {
                throw new CancellationException("Training cancelled after " + i + " of " + numTrees + " trees");
            }
            double[][] sample = subsample(data, psi, random);
            trees.add(new IsolationTreeBuilder(sample, maxDepth, random).build());
        }

        return ModelVersion.builder()
                .versionId(versionId)
                .trainedAt(System.currentTimeMillis())
                .trainingSampleSize(data.length)
                .subSampleSize(psi)
                .dimensions(dimensions)
                .featureNames(featureNames)
                .expectedPathLength(PathLength.average(psi))
                .trees(trees)
                .build();
    }

    private double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        double[][] sample = new double[size][];
        // Partial Fisher-Yates shuffle on indices: draws without replacement
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) indices[i] = i;
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }
}
