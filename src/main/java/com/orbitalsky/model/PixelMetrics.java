package com.orbitalsky.model;

/** Pixel-level confusion counts between a predicted and a ground-truth mask. */
public class PixelMetrics {
    public final long truePositives;
    public final long falsePositives;
    public final long falseNegatives;
    public final long trueNegatives;
    public final double precision;
    public final double recall;
    public final double f1Score;

    public PixelMetrics(long tp, long fp, long fn, long tn) {
        this.truePositives = tp;
        this.falsePositives = fp;
        this.falseNegatives = fn;
        this.trueNegatives = tn;
        this.precision = ratio(tp, tp + fp);
        this.recall = ratio(tp, tp + fn);
        this.f1Score = harmonic(precision, recall);
    }

    static double ratio(long num, long den) {
        return den > 0 ? (double) num / den : 0.0;
    }

    static double harmonic(double p, double r) {
        return (p + r) > 0 ? 2 * p * r / (p + r) : 0.0;
    }
}
