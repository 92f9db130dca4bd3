package com.sensor.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.sensor.anomaly.engine.isolationforest.IsolationTree;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A trained isolation ensemble. Once published it is never mutated; a newer version
 * supersedes it.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelVersion {

    long versionId;

    long trainedAt;

    // Number of buffered samples the ensemble was drawn from
    int trainingSampleSize;

    // Effective ψ: per-tree sub-sample size
    int subSampleSize;

    int dimensions;

    @Singular
    List<String> featureNames;

    // c(ψ): normalizer for path lengths
    double expectedPathLength;

    @Singular
    List<IsolationTree> trees;

    public ModelSummary summary() {
        return new ModelSummary(versionId, trainedAt, trainingSampleSize, subSampleSize,
                dimensions, trees.size(), expectedPathLength, featureNames);
    }

    @Schema(description = "Metadata of a published model version")
    public record ModelSummary(long versionId, long trainedAt, int trainingSampleSize, int subSampleSize,
                               int dimensions, int treeCount, double expectedPathLength,
                               List<String> featureNames) {}
}
