package com.sensor.anomaly.engine.isolationforest;

import com.sensor.anomaly.model.ModelVersion;
import com.sensor.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class IsolationForestTrainerTest {

    private static final List<String> NAMES = List.of("x", "y");

    private final IsolationForestTrainer trainer = new IsolationForestTrainer();

    private static double score(ModelVersion model, double... point) {
        double total = 0.0;
        for (IsolationTree tree : model.getTrees()) {
            total += tree.pathLength(point);
        }
        return Math.pow(2.0, -(total / model.getTrees().size()) / model.getExpectedPathLength());
    }

    @Test
    void train_isolatedPointScoresHigherThanClusterCenter() {
        double[][] data = TestDataFactory.gaussianRows(1000, 2, 0.0, 1.0, 42);

        ModelVersion model = trainer.train(data, NAMES, 1, 100, 256, 7L, () -> false);

        double outlier = score(model, 8.0, 8.0);
        double center = score(model, 0.0, 0.0);
        assertThat(outlier).isGreaterThan(center);
        assertThat(outlier).isGreaterThan(0.6);
        assertThat(center).isLessThan(0.5);
    }

    @Test
    void train_outlierInTrainingSet_scoresAboveEveryInlier() {
        for (long seed = 1; seed <= 25; seed++) {
            double[][] inliers = TestDataFactory.gaussianRows(49, 2, 0.0, 1.0, seed);
            double[][] data = Arrays.copyOf(inliers, 50);
            data[49] = new double[]{20.0, 20.0};

            // psi equals the row count, so every tree sees the outlier
            ModelVersion model = trainer.train(data, NAMES, 1, 10, 50, seed, () -> false);

            double outlier = score(model, 20.0, 20.0);
            double maxInlier = Arrays.stream(inliers).mapToDouble(row -> score(model, row)).max().orElseThrow();
            assertThat(outlier).as("seed %d", seed).isGreaterThan(maxInlier);
        }
    }

    @Test
    void train_populatesVersionMetadata() {
        double[][] data = TestDataFactory.gaussianRows(300, 2, 0.0, 1.0, 1);

        ModelVersion model = trainer.train(data, NAMES, 9, 20, 128, 3L, () -> false);

        assertThat(model.getVersionId()).isEqualTo(9);
        assertThat(model.getTrees()).hasSize(20);
        assertThat(model.getSubSampleSize()).isEqualTo(128);
        assertThat(model.getTrainingSampleSize()).isEqualTo(300);
        assertThat(model.getDimensions()).isEqualTo(2);
        assertThat(model.getFeatureNames()).containsExactly("x", "y");
        assertThat(model.getExpectedPathLength()).isEqualTo(PathLength.average(128));
    }

    @Test
    void train_treeDepthNeverExceedsLog2OfSubSample() {
        double[][] data = TestDataFactory.gaussianRows(500, 2, 0.0, 1.0, 5);

        ModelVersion model = trainer.train(data, NAMES, 1, 30, 64, 11L, () -> false);

        for (IsolationTree tree : model.getTrees()) {
            assertThat(tree.depth()).isLessThanOrEqualTo(6);
            assertThat(tree.maxFeatureIndex()).isLessThan(2);
            assertThat(tree.nodeCount()).isLessThanOrEqualTo(2 * 64 - 1);
        }
    }

    @Test
    void train_subSampleCappedAtAvailableRows() {
        double[][] data = TestDataFactory.gaussianRows(10, 2, 0.0, 1.0, 5);

        ModelVersion model = trainer.train(data, NAMES, 1, 5, 256, 1L, () -> false);

        assertThat(model.getSubSampleSize()).isEqualTo(10);
    }

    @Test
    void train_sameSeed_producesIdenticalScores() {
        double[][] data = TestDataFactory.gaussianRows(400, 2, 0.0, 1.0, 8);

        ModelVersion first = trainer.train(data, NAMES, 1, 25, 128, 99L, () -> false);
        ModelVersion second = trainer.train(data, NAMES, 2, 25, 128, 99L, () -> false);

        assertThat(score(first, 1.5, -0.3)).isEqualTo(score(second, 1.5, -0.3));
        assertThat(score(first, 6.0, 6.0)).isEqualTo(score(second, 6.0, 6.0));
    }

    @Test
    void train_constantData_scoresEveryPointAtOneHalf() {
        double[][] data = new double[100][];
        for (int i = 0; i < data.length; i++) {
            data[i] = new double[] {5.0, 5.0};
        }

        ModelVersion model = trainer.train(data, NAMES, 1, 10, 64, 1L, () -> false);

        assertThat(score(model, 5.0, 5.0)).isCloseTo(0.5, within(1e-12));
        assertThat(score(model, 50.0, -3.0)).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void train_cancelledBeforeFirstTree_throwsCancellation() {
        double[][] data = TestDataFactory.gaussianRows(100, 2, 0.0, 1.0, 2);

        assertThatThrownBy(() -> trainer.train(data, NAMES, 1, 10, 64, 1L, () -> true))
                .isInstanceOf(CancellationException.class);
    }

    @Test
    void train_cancelledBetweenTrees_stopsAtTreeBoundary() {
        double[][] data = TestDataFactory.gaussianRows(100, 2, 0.0, 1.0, 2);
        AtomicInteger polls = new AtomicInteger();

        assertThatThrownBy(() -> trainer.train(data, NAMES, 1, 10, 64, 1L, () -> polls.incrementAndGet() > 3))
                .isInstanceOf(CancellationException.class)
                .hasMessageContaining("after 3 of 10");
    }

    @Test
    void train_singleRow_throwsIllegalArgument() {
        assertThatThrownBy(() -> trainer.train(new double[][] {{1.0, 2.0}}, NAMES, 1, 10, 64, 1L, () -> false))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void train_rowWidthDiffersFromFeatureNames_throwsIllegalArgument() {
        double[][] data = TestDataFactory.gaussianRows(10, 3, 0.0, 1.0, 2);

        assertThatThrownBy(() -> trainer.train(data, NAMES, 1, 10, 64, 1L, () -> false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
