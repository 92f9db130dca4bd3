package com.sensor.anomaly.engine.isolationforest;

public final class PathLength {

    private static final double EULER_GAMMA = 0.5772156649;

    private PathLength() {}

    /**
     * Average path length of an unsuccessful search in a BST of n points (Equation 1 of the
     * isolation forest paper): c(n) = 2H(n-1) - 2(n-1)/n, with H(i) = ln(i) + γ.
     */
    public static double average(int n) {
        if (n <= 1) return 0;
        if (n == 2) return 1;
        double harmonicNumber = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonicNumber - (2.0 * (n - 1.0) / n);
    }

    public static int maxDepth(int subSampleSize) {
        return (int) Math.ceil(Math.log(subSampleSize) / Math.log(2));
    }
}
