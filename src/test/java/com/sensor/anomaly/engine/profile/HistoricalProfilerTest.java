package com.sensor.anomaly.engine.profile;

import com.sensor.anomaly.exception.FeatureShapeMismatchException;
import com.sensor.anomaly.exception.SchemaMismatchException;
import com.sensor.anomaly.model.FeatureStatistics;
import com.sensor.anomaly.model.FeatureVector;
import com.sensor.anomaly.model.ProfileState;
import com.sensor.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HistoricalProfilerTest {

    private static final List<String> NAMES = List.of("x", "y");

    private HistoricalProfiler profiler;

    @BeforeEach
    void setUp() {
        profiler = new HistoricalProfiler(TestDataFactory.twoFeatureSchema(), TestDataFactory.profileConfig());
    }

    private void observe(double x, double y) {
        profiler.observe(TestDataFactory.createVector("R", NAMES, x, y));
    }

    @Test
    void observe_incrementalStatisticsMatchBatchComputation() {
        Random random = new Random(11);
        List<Double> xs = new ArrayList<>();
        for (int i = 0; i < 5000; i++) {
            double x = 150 + random.nextGaussian() * 25;
            xs.add(x);
            observe(x, i % 7);
        }

        double mean = xs.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
        double variance = xs.stream().mapToDouble(v -> (v - mean) * (v - mean)).sum() / xs.size();

        FeatureStatistics stats = profiler.snapshot().get(0);
        assertThat(stats.getCount()).isEqualTo(5000);
        assertThat(stats.getMean()).isCloseTo(mean, within(1e-9));
        assertThat(stats.getVariance()).isCloseTo(variance, within(1e-6));
        assertThat(stats.getMin()).isEqualTo(Collections.min(xs));
        assertThat(stats.getMax()).isEqualTo(Collections.max(xs));
    }

    @Test
    void observe_constantStream_varianceIsZeroNotNegative() {
        for (int i = 0; i < 1000; i++) {
            observe(0.1, 0.1);
        }

        FeatureStatistics stats = profiler.snapshot().get(0);
        assertThat(stats.getVariance()).isGreaterThanOrEqualTo(0.0);
        assertThat(stats.getVariance()).isCloseTo(0.0, within(1e-12));
    }

    @Test
    void observe_wrongDimensions_throwsFeatureShapeMismatch() {
        FeatureVector vector = TestDataFactory.createVector("R", List.of("x"), 1.0);

        assertThatThrownBy(() -> profiler.observe(vector))
                .isInstanceOf(FeatureShapeMismatchException.class);
        assertThat(profiler.snapshot().get(0).getCount()).isZero();
    }

    @Test
    void snapshot_isNotAffectedByLaterUpdates() {
        observe(1.0, 2.0);
        ProfileState before = profiler.snapshot();

        observe(100.0, 200.0);

        assertThat(before.get(0).getCount()).isEqualTo(1);
        assertThat(before.get(0).getMean()).isEqualTo(1.0);
        assertThat(profiler.snapshot().get(0).getCount()).isEqualTo(2);
    }

    @Test
    void snapshot_reportsFeaturesInSchemaOrder() {
        assertThat(profiler.snapshot().getFeatureNames()).containsExactly("x", "y");
    }

    @Test
    void quantiles_approximateUniformDistribution() {
        List<Double> values = new ArrayList<>();
        for (int i = 1; i <= 2000; i++) {
            values.add((double) i);
        }
        Collections.shuffle(values, new Random(3));
        values.forEach(v -> observe(v, v));

        FeatureStatistics stats = profiler.snapshot().get(0);
        assertThat(stats.quantile(0.5)).isCloseTo(1000.0, within(60.0));
        assertThat(stats.quantile(0.9)).isCloseTo(1800.0, within(60.0));
        assertThat(stats.quantile(0.99)).isCloseTo(1980.0, within(40.0));
        assertThat(stats.getQuantileEstimates()).containsOnlyKeys("p50", "p90", "p99");
    }

    @Test
    void quantiles_fewerThanFiveObservations_useNearestRank() {
        observe(30.0, 0.0);
        observe(10.0, 0.0);
        observe(20.0, 0.0);

        assertThat(profiler.snapshot().get(0).quantile(0.5)).isEqualTo(20.0);
    }

    @Test
    void quantiles_noObservations_reportNoEstimates() {
        assertThat(profiler.snapshot().get(0).getQuantileEstimates()).isEmpty();
    }

    @Test
    void reset_namedFeature_clearsOnlyThatFeature() {
        observe(5.0, 6.0);

        List<String> reset = profiler.reset(List.of("y"));

        ProfileState state = profiler.snapshot();
        assertThat(reset).containsExactly("y");
        assertThat(state.get(0).getCount()).isEqualTo(1);
        assertThat(state.get(1).getCount()).isZero();
    }

    @Test
    void reset_emptySelection_clearsAllFeatures() {
        observe(5.0, 6.0);

        List<String> reset = profiler.reset(List.of());

        assertThat(reset).containsExactly("x", "y");
        assertThat(profiler.snapshot().get(0).getCount()).isZero();
        assertThat(profiler.snapshot().get(1).getCount()).isZero();
    }

    @Test
    void reset_unknownFeature_throwsSchemaMismatch() {
        observe(5.0, 6.0);

        assertThatThrownBy(() -> profiler.reset(List.of("z")))
                .isInstanceOf(SchemaMismatchException.class);
        assertThat(profiler.snapshot().get(0).getCount()).isEqualTo(1);
    }

    @Test
    void restore_continuesFromPersistedState() {
        for (int i = 0; i < 100; i++) {
            observe(i, 2 * i);
        }
        ProfileState persisted = profiler.snapshot();

        HistoricalProfiler restored = new HistoricalProfiler(
                TestDataFactory.twoFeatureSchema(), TestDataFactory.profileConfig());
        restored.restore(persisted);
        restored.observe(TestDataFactory.createVector("R", NAMES, 100.0, 200.0));
        observe(100.0, 200.0);

        FeatureStatistics expected = profiler.snapshot().get(0);
        FeatureStatistics actual = restored.snapshot().get(0);
        assertThat(actual.getCount()).isEqualTo(expected.getCount());
        assertThat(actual.getMean()).isEqualTo(expected.getMean());
        assertThat(actual.getM2()).isEqualTo(expected.getM2());
        assertThat(actual.quantile(0.5)).isEqualTo(expected.quantile(0.5));
    }

    @Test
    void restore_mismatchedFeatures_throwsSchemaMismatch() {
        ProfileState other = ProfileState.builder()
                .feature(FeatureStatistics.builder().name("sensor_value").build())
                .build();

        assertThatThrownBy(() -> profiler.restore(other))
                .isInstanceOf(SchemaMismatchException.class);
    }

    @Test
    void observe_concurrentWriters_noUpdatesLost() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        for (int t = 0; t < 4; t++) {
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < 1000; i++) {
                    observe(1.0, 1.0);
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        FeatureStatistics stats = profiler.snapshot().get(0);
        assertThat(stats.getCount()).isEqualTo(4000);
        assertThat(stats.getMean()).isEqualTo(1.0);
    }
}
