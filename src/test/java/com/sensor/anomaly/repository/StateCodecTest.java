package com.sensor.anomaly.repository;

import com.sensor.anomaly.engine.isolationforest.IsolationForestTrainer;
import com.sensor.anomaly.engine.profile.HistoricalProfiler;
import com.sensor.anomaly.engine.scoring.Scorer;
import com.sensor.anomaly.model.AlertEvent;
import com.sensor.anomaly.model.AlertState;
import com.sensor.anomaly.model.FeatureStatistics;
import com.sensor.anomaly.model.FeatureVector;
import com.sensor.anomaly.model.ModelVersion;
import com.sensor.anomaly.model.ProfileState;
import com.sensor.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StateCodecTest {

    private static final List<String> NAMES = List.of("x", "y");

    private final StateCodec codec = new StateCodec();

    @Test
    void model_roundTrip_producesBitIdenticalScores() throws Exception {
        double[][] data = TestDataFactory.gaussianRows(500, 2, 150.0, 25.0, 31);
        ModelVersion model = new IsolationForestTrainer().train(data, NAMES, 12, 50, 128, 4L, () -> false);

        ModelVersion restored = codec.readModel(codec.writeModel(model));

        assertThat(restored.summary()).isEqualTo(model.summary());
        HistoricalProfiler profiler = new HistoricalProfiler(TestDataFactory.twoFeatureSchema(), TestDataFactory.profileConfig());
        for (double[] row : data) {
            profiler.observe(TestDataFactory.createVector("R", NAMES, row));
        }
        ProfileState profile = profiler.snapshot();
        Scorer scorer = new Scorer();
        double[][] probes = {{150.0, 150.0}, {900.0, 0.0}, {151.25, 149.875}, {0.0, 0.0}};
        for (double[] probe : probes) {
            FeatureVector vector = TestDataFactory.createVector("P", NAMES, probe);
            assertThat(Double.doubleToLongBits(scorer.score(vector, restored, profile).getNormalizedScore()))
                    .isEqualTo(Double.doubleToLongBits(scorer.score(vector, model, profile).getNormalizedScore()));
        }
    }

    @Test
    void profile_roundTrip_preservesStatisticsExactly() throws Exception {
        HistoricalProfiler profiler = new HistoricalProfiler(TestDataFactory.twoFeatureSchema(), TestDataFactory.profileConfig());
        double[][] data = TestDataFactory.gaussianRows(300, 2, 10.0, 3.0, 8);
        for (double[] row : data) {
            profiler.observe(TestDataFactory.createVector("R", NAMES, row));
        }
        ProfileState profile = profiler.snapshot();

        ProfileState restored = codec.readProfile(codec.writeProfile(profile));

        assertThat(restored.getCapturedAt()).isEqualTo(profile.getCapturedAt());
        assertThat(restored.getFeatureNames()).containsExactly("x", "y");
        for (int i = 0; i < profile.dimensions(); i++) {
            FeatureStatistics expected = profile.get(i);
            FeatureStatistics actual = restored.get(i);
            assertThat(actual.getCount()).isEqualTo(expected.getCount());
            assertThat(actual.getMean()).isEqualTo(expected.getMean());
            assertThat(actual.getM2()).isEqualTo(expected.getM2());
            assertThat(actual.getMin()).isEqualTo(expected.getMin());
            assertThat(actual.getMax()).isEqualTo(expected.getMax());
            assertThat(actual.getQuantileEstimates()).isEqualTo(expected.getQuantileEstimates());
        }
    }

    @Test
    void event_roundTrip_preservesContributions() throws Exception {
        AlertEvent event = TestDataFactory.createAlertEvent("EV-9", AlertState.ONGOING);

        AlertEvent restored = codec.readEvent(codec.writeEvent(event));

        assertThat(restored).isEqualTo(event);
    }
}
