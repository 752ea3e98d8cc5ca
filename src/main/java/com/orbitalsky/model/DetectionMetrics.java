package com.orbitalsky.model;

public class DetectionMetrics {
    public final double iou;
    public final double precision;
    public final double recall;
    public final double f1Score;
    public final long truePositives;
    public final long falsePositives;
    public final long falseNegatives;
    public final int numGtStreaks;
    public final int numPredStreaks;

    public DetectionMetrics(double iou, PixelMetrics pixels, int numGtStreaks, int numPredStreaks) {
        this.iou = iou;
        this.precision = pixels.precision;
        this.recall = pixels.recall;
        this.f1Score = pixels.f1Score;
        this.truePositives = pixels.truePositives;
        this.falsePositives = pixels.falsePositives;
        this.falseNegatives = pixels.falseNegatives;
        this.numGtStreaks = numGtStreaks;
        this.numPredStreaks = numPredStreaks;
    }
}
