package com.orbitalsky.model;

/**
 * Dataset-level detection quality. The {@code mean*}/{@code median*}/{@code std*} fields average per-frame
 * scores; the {@code global*} fields are computed once from the summed pixel counts.
 */
public class ValidationSummary {
    public final int numFrames;
    public final double meanIou;
    public final double stdIou;
    public final double medianIou;
    public final double meanPrecision;
    public final double meanRecall;
    public final double meanF1;
    public final double globalPrecision;
    public final double globalRecall;
    public final double globalF1;
    public final long totalTp;
    public final long totalFp;
    public final long totalFn;

    public ValidationSummary(int numFrames, double meanIou, double stdIou, double medianIou,
                             double meanPrecision, double meanRecall, double meanF1,
                             long totalTp, long totalFp, long totalFn) {
        this.numFrames = numFrames;
        this.meanIou = meanIou;
        this.stdIou = stdIou;
        this.medianIou = medianIou;
        this.meanPrecision = meanPrecision;
        this.meanRecall = meanRecall;
        this.meanF1 = meanF1;
        this.totalTp = totalTp;
        this.totalFp = totalFp;
        this.totalFn = totalFn;
        this.globalPrecision = PixelMetrics.ratio(totalTp, totalTp + totalFp);
        this.globalRecall = PixelMetrics.ratio(totalTp, totalTp + totalFn);
        this.globalF1 = PixelMetrics.harmonic(globalPrecision, globalRecall);
    }

    public static ValidationSummary empty() {
        return new ValidationSummary(0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
    }
}
