package com.sensor.anomaly.engine.scoring;

import com.sensor.anomaly.engine.isolationforest.IsolationTree;
import com.sensor.anomaly.exception.FeatureShapeMismatchException;
import com.sensor.anomaly.model.AnomalyScore;
import com.sensor.anomaly.model.FeatureStatistics;
import com.sensor.anomaly.model.FeatureVector;
import com.sensor.anomaly.model.ModelVersion;
import com.sensor.anomaly.model.ProfileState;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores feature vectors against a model version and a profile snapshot. Both inputs are
 * immutable and only read, so one scorer is shared by every caller.
 *
 * Scoring:
 *   s(x, ψ) = 2^(-E(h(x)) / c(ψ)), in (0, 1].
 *   Values near 1 are strong anomalies; ~0.5 is a typical point.
 *   The deviation score is the largest |z| of any feature against the profile, a cheap
 *   corroborating signal independent of the trees.
 */
@Component
public class Scorer {

    public AnomalyScore score(FeatureVector vector, ModelVersion model, ProfileState profile) {
        checkShape(vector, model, profile);

        double[] point = vector.toArray();
        double avgPathLength = averagePathLength(point, model);

        return AnomalyScore.builder()
                .recordId(vector.getRecordId())
                .entityId(vector.getEntityId())
                .rawScore(avgPathLength)
                .normalizedScore(normalize(avgPathLength, model))
                .deviationScore(deviation(point, profile))
                .modelVersionId(model.getVersionId())
                .build();
    }

    /**
     * Compute feature contributions: which features pushed this point toward anomaly.
     * Each feature in turn is replaced by its profile mean and the drop in score is recorded.
     */
    public Map<String, Double> explain(FeatureVector vector, ModelVersion model, ProfileState profile) {
        checkShape(vector, model, profile);

        double[] point = vector.toArray();
        double baseScore = normalize(averagePathLength(point, model), model);
        Map<String, Double> contributions = new LinkedHashMap<>();

        for (int i = 0; i < point.length; i++) {
            FeatureStatistics stats = profile.get(i);
            double replacement = stats.getCount() > 0 ? stats.getMean() : point[i];
            double[] modified = Arrays.copyOf(point, point.length);
            modified[i] = replacement;
            double modifiedScore = normalize(averagePathLength(modified, model), model);
            contributions.put(vector.getNames().get(i), Math.max(0, baseScore - modifiedScore));
        }
        return contributions;
    }

    private double averagePathLength(double[] point, ModelVersion model) {
        List<IsolationTree> trees = model.getTrees();
        double total = 0.0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(point);
        }
        return total / trees.size();
    }

    private double normalize(double avgPathLength, ModelVersion model) {
        return Math.pow(2.0, -avgPathLength / model.getExpectedPathLength());
    }

    private double deviation(double[] point, ProfileState profile) {
        double maxAbsZ = 0.0;
        for (int i = 0; i < point.length; i++) {
            FeatureStatistics stats = profile.get(i);
            double stdDev = stats.getStdDev();
            if (stats.getCount() > 1 && stdDev > 0) {
                maxAbsZ = Math.max(maxAbsZ, Math.abs(point[i] - stats.getMean()) / stdDev);
            }
        }
        return maxAbsZ;
    }

    private void checkShape(FeatureVector vector, ModelVersion model, ProfileState profile) {
        if (vector.dimensions() != model.getDimensions()) {
            throw new FeatureShapeMismatchException(model.getDimensions(), vector.dimensions());
        }
        if (vector.dimensions() != profile.dimensions()) {
            throw new FeatureShapeMismatchException(profile.dimensions(), vector.dimensions());
        }
    }
}
