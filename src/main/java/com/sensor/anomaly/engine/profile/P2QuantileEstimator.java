package com.sensor.anomaly.engine.profile;

import com.sensor.anomaly.model.QuantileSketch;

import java.util.Arrays;

/**
 * P² (Jain &amp; Chlamtac) streaming quantile estimator: five markers, constant memory.
 * Not thread-safe; owned by a {@link RunningStatistics}.
 */
final class P2QuantileEstimator {

    private static final int M = QuantileSketch.MARKERS;

    private final double p;
    private long count;
    private final double[] q = new double[M];    // marker heights
    private final int[] n = new int[M];          // actual positions, 1-based
    private final double[] np = new double[M];   // desired positions
    private final double[] dn;                   // desired position increments

    P2QuantileEstimator(double p) {
        if (p <= 0.0 || p >= 1.0) {
            throw new IllegalArgumentException("Quantile probability must be in (0, 1): " + p);
        }
        this.p = p;
        this.dn = new double[] {0.0, p / 2, p, (1 + p) / 2, 1.0};
        resetMarkers();
    }

    static P2QuantileEstimator fromSketch(QuantileSketch sketch) {
        P2QuantileEstimator estimator = new P2QuantileEstimator(sketch.getProbability());
        estimator.count = sketch.getCount();
        System.arraycopy(sketch.getHeights(), 0, estimator.q, 0, M);
        System.arraycopy(sketch.getPositions(), 0, estimator.n, 0, M);
        System.arraycopy(sketch.getDesired(), 0, estimator.np, 0, M);
        return estimator;
    }

    void add(double x) {
        if (count < M) {
            q[(int) count] = x;
            count++;
            if (count == M) {
                Arrays.sort(q);
            }
            return;
        }
        count++;

        int k;
        if (x < q[0]) {
            q[0] = x;
            k = 0;
        } else if (x >= q[M - 1]) {
            q[M - 1] = x;
            k = M - 2;
        } else {
            k = 0;
            while (k < M - 2 && x >= q[k + 1]) {
                k++;
            }
        }

        for (int i = k + 1; i < M; i++) {
            n[i]++;
        }
        for (int i = 0; i < M; i++) {
            np[i] += dn[i];
        }

        for (int i = 1; i < M - 1; i++) {
            double d = np[i] - n[i];
            if ((d >= 1 && n[i + 1] - n[i] > 1) || (d <= -1 && n[i - 1] - n[i] < -1)) {
                int step = d > 0 ? 1 : -1;
                double candidate = parabolic(i, step);
                if (q[i - 1] < candidate && candidate < q[i + 1]) {
                    q[i] = candidate;
                } else {
                    q[i] = linear(i, step);
                }
                n[i] += step;
            }
        }
    }

    void reset() {
        count = 0;
        Arrays.fill(q, 0.0);
        resetMarkers();
    }

    QuantileSketch snapshot() {
        return new QuantileSketch(p, count, q, n, np);
    }

    private void resetMarkers() {
        for (int i = 0; i < M; i++) {
            n[i] = i + 1;
        }
        np[0] = 1;
        np[1] = 1 + 2 * p;
        np[2] = 1 + 4 * p;
        np[3] = 3 + 2 * p;
        np[4] = 5;
    }

    private double parabolic(int i, int d) {
        return q[i] + (double) d / (n[i + 1] - n[i - 1])
                * ((n[i] - n[i - 1] + d) * (q[i + 1] - q[i]) / (n[i + 1] - n[i])
                + (n[i + 1] - n[i] - d) * (q[i] - q[i - 1]) / (n[i] - n[i - 1]));
    }

    private double linear(int i, int d) {
        return q[i] + d * (q[i + d] - q[i]) / (n[i + d] - n[i]);
    }
}
