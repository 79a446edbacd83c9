package com.mist.anomaly.common;

import java.util.List;

/**
 * Array helpers shared by the estimator, the detector and the reports.
 */
public class SeriesUtils {

    /**
     * Apply d successive first differences.  The result is d elements shorter; element t of the result belongs to
     * timestamp t + d of the input.
     */
    public static double[] difference(double[] values, int d) {
        assert d >= 0 : "SeriesUtils.difference: d cannot be negative";
        double[] result = values.clone();
        for (int k = 0; k < d; k++) {
            double[] next = new double[Math.max(0, result.length - 1)];
            for (int i = 1; i < result.length; i++)
                next[i - 1] = result[i] - result[i - 1];
            result = next;
        }
        return result;
    }

    /**
     * Recover the level at index t from a differenced value at t and the d previous levels:
     * y(t) = w(t) + sum_{k=1..d} (-1)^(k+1) C(d,k) y(t-k)
     * @param differenced the d-times differenced value belonging to index t
     * @param levels the original series, read only below t
     */
    public static double undifference(double differenced, double[] levels, int t, int d) {
        assert t >= d : "SeriesUtils.undifference: need d levels before t";
        double level = differenced;
        for (int k = 1; k <= d; k++) {
            double sign = (k % 2 == 1) ? 1.0 : -1.0;
            level += sign * binomial(d, k) * levels[t - k];
        }
        return level;
    }

    public static long binomial(int n, int k) {
        assert k >= 0 && k <= n : "SeriesUtils.binomial: k out of range";
        long result = 1;
        for (int i = 1; i <= k; i++)
            result = result * (n - k + i) / i;
        return result;
    }

    public static double getRMSE(List<Double> actual, List<Double> predictions) {
        assert actual.size() == predictions.size();
        if (actual.isEmpty())
            return 0.0;
        double sumSquaredError = 0.0;
        for (int i = 0; i < actual.size(); i++) {
            double error = actual.get(i) - predictions.get(i);
            sumSquaredError += error * error;
        }
        return Math.sqrt(sumSquaredError / actual.size());
    }

    public static double maxAbsDiff(double[] a, double[] b) {
        assert a.length == b.length;
        double max = 0.0;
        for (int i = 0; i < a.length; i++)
            max = Math.max(max, Math.abs(a[i] - b[i]));
        return max;
    }

    public static boolean allFinite(double[] values) {
        for (double v : values)
            if (Double.isNaN(v) || Double.isInfinite(v))
                return false;
        return true;
    }
}
