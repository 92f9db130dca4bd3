package com.sensor.anomaly.engine.isolationforest;

import java.util.Arrays;
import java.util.Random;

/**
 * Grows one isolation tree over a sub-sample, writing nodes into flat arrays. A tree over
 * n points never has more than 2n - 1 nodes, so the arena is sized once and trimmed.
 */
final class IsolationTreeBuilder {

    private final double[][] data;
    private final int maxDepth;
    private final Random random;
    private final int dimensions;

    private final int[] splitFeature;
    private final double[] splitValue;
    private final int[] left;
    private final int[] right;
    private final boolean[] leaf;
    private final int[] size;
    private int nodeCount;

    // scratch for picking a feature with spread
    private final int[] candidates;

    IsolationTreeBuilder(double[][] data, int maxDepth, Random random) {
        this.data = data;
        this.maxDepth = maxDepth;
        this.random = random;
        this.dimensions = data[0].length;
        int capacity = 2 * data.length - 1;
        this.splitFeature = new int[capacity];
        this.splitValue = new double[capacity];
        this.left = new int[capacity];
        this.right = new int[capacity];
        this.leaf = new boolean[capacity];
        this.size = new int[capacity];
        this.candidates = new int[dimensions];
    }

    IsolationTree build() {
        int[] rows = new int[data.length];
        for (int i = 0; i < rows.length; i++) rows[i] = i;
        buildNode(rows, 0, rows.length, 0);
        return new IsolationTree(
                Arrays.copyOf(splitFeature, nodeCount),
                Arrays.copyOf(splitValue, nodeCount),
                Arrays.copyOf(left, nodeCount),
                Arrays.copyOf(right, nodeCount),
                Arrays.copyOf(leaf, nodeCount),
                Arrays.copyOf(size, nodeCount));
    }

    /** Builds the node for rows[from, to) and returns its arena index. */
    private int buildNode(int[] rows, int from, int to, int depth) {
        int node = nodeCount++;
        int n = to - from;

        if (depth >= maxDepth || n <= 1) {
            return makeLeaf(node, n);
        }

        // Uniform choice among features that still vary inside this node
        int spread = 0;
        for (int f = 0; f < dimensions; f++) {
            double first = data[rows[from]][f];
            for (int i = from + 1; i < to; i++) {
                if (data[rows[i]][f] != first) {
                    candidates[spread++] = f;
                    break;
                }
            }
        }
        if (spread == 0) {
            return makeLeaf(node, n);
        }
        int featureIdx = candidates[random.nextInt(spread)];

        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (int i = from; i < to; i++) {
            double value = data[rows[i]][featureIdx];
            if (value < min) min = value;
            if (value > max) max = value;
        }

        double split = min + random.nextDouble() * (max - min);
        if (split <= min) {
            // nextDouble() returned 0: keep the min point on the left so both sides are non-empty
            split = Math.nextUp(min);
        }

        // In-place partition: rows[from, mid) go left
        int mid = from;
        for (int i = from; i < to; i++) {
            if (data[rows[i]][featureIdx] < split) {
                int tmp = rows[mid];
                rows[mid] = rows[i];
                rows[i] = tmp;
                mid++;
            }
        }

        splitFeature[node] = featureIdx;
        splitValue[node] = split;
        leaf[node] = false;
        left[node] = buildNode(rows, from, mid, depth + 1);
        right[node] = buildNode(rows, mid, to, depth + 1);
        return node;
    }

    private int makeLeaf(int node, int n) {
        leaf[node] = true;
        size[node] = n;
        splitFeature[node] = IsolationTree.NONE;
        left[node] = IsolationTree.NONE;
        right[node] = IsolationTree.NONE;
        return node;
    }
}
