package com.sensor.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;

/**
 * One isolation tree stored as a flat node arena. Node 0 is the root; children are
 * referenced by index. Internal nodes send a point left when
 * {@code point[feature] < splitValue}. Leaves carry the number of training points that
 * reached them, used for the path-length correction.
 *
 * <p>The arrays are private and never handed out, so a tree cannot be changed after
 * construction.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class IsolationTree {

    static final int NONE = -1;

    @JsonProperty("f")
    private final int[] splitFeature;

    @JsonProperty("v")
    private final double[] splitValue;

    @JsonProperty("l")
    private final int[] left;

    @JsonProperty("r")
    private final int[] right;

    @JsonProperty("e")
    private final boolean[] leaf;

    @JsonProperty("s")
    private final int[] size;

    @JsonCreator
    public IsolationTree(@JsonProperty("f") int[] splitFeature,
                         @JsonProperty("v") double[] splitValue,
                         @JsonProperty("l") int[] left,
                         @JsonProperty("r") int[] right,
                         @JsonProperty("e") boolean[] leaf,
                         @JsonProperty("s") int[] size) {
        int n = splitFeature.length;
        if (n == 0 || splitValue.length != n || left.length != n || right.length != n
                || leaf.length != n || size.length != n) {
            throw new IllegalArgumentException("Tree arena arrays must be non-empty and of equal length");
        }
        this.splitFeature = Arrays.copyOf(splitFeature, n);
        this.splitValue = Arrays.copyOf(splitValue, n);
        this.left = Arrays.copyOf(left, n);
        this.right = Arrays.copyOf(right, n);
        this.leaf = Arrays.copyOf(leaf, n);
        this.size = Arrays.copyOf(size, n);
        validateLinks();
    }

    /**
     * Path length of {@code point}: edges walked to its leaf plus c(size) for the points
     * left unseparated in that leaf.
     */
    public double pathLength(double[] point) {
        int node = 0;
        int depth = 0;
        while (!leaf[node]) {
            node = point[splitFeature[node]] < splitValue[node] ? left[node] : right[node];
            depth++;
        }
        return depth + PathLength.average(size[node]);
    }

    public int nodeCount() {
        return splitFeature.length;
    }

    public int depth() {
        return depthOf(0);
    }

    public int maxFeatureIndex() {
        int max = NONE;
        for (int i = 0; i < splitFeature.length; i++) {
            if (!leaf[i]) {
                max = Math.max(max, splitFeature[i]);
            }
        }
        return max;
    }

    private int depthOf(int node) {
        if (leaf[node]) {
            return 0;
        }
        return 1 + Math.max(depthOf(left[node]), depthOf(right[node]));
    }

    // Children always have a higher index than their parent, so the arena is acyclic
    private void validateLinks() {
        for (int i = 0; i < splitFeature.length; i++) {
            if (leaf[i]) {
                continue;
            }
            if (left[i] <= i || right[i] <= i || left[i] >= splitFeature.length || right[i] >= splitFeature.length) {
                throw new IllegalArgumentException("Invalid child reference at node " + i);
            }
        }
    }
}
