package com.orbitalsky.utils;

import java.util.Arrays;
import java.util.List;

/**
 * Order statistics over plain arrays. Percentiles interpolate linearly between the two closest ranks,
 * so the 50th percentile of an even-length sample is the mean of the middle pair.
 */
public final class Stats {

    private Stats() {
    }

    public static double percentile(double[] values, double p) {
        if (values.length == 0) throw new IllegalArgumentException("percentile of an empty sample");
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return percentileOfSorted(sorted, p);
    }

    public static double percentileOfSorted(double[] sorted, double p) {
        if (sorted.length == 1) return sorted[0];
        double rank = Math.max(0, Math.min(100, p)) / 100.0 * (sorted.length - 1);
        int lo = (int) Math.floor(rank);
        int hi = Math.min(lo + 1, sorted.length - 1);
        double frac = rank - lo;
        return sorted[lo] + (sorted[hi] - sorted[lo]) * frac;
    }

    public static double median(double[] values) {
        return percentile(values, 50.0);
    }

    public static double mean(double[] values) {
        if (values.length == 0) return 0.0;
        double s = 0;
        for (double v : values) s += v;
        return s / values.length;
    }

    /** Population standard deviation. */
    public static double std(double[] values) {
        if (values.length == 0) return 0.0;
        double m = mean(values);
        double s = 0;
        for (double v : values) s += (v - m) * (v - m);
        return Math.sqrt(s / values.length);
    }

    public static double[] toArray(List<Double> values) {
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) out[i] = values.get(i);
        return out;
    }
}
