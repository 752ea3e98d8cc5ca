package com.orbitalsky.config;

import com.orbitalsky.detection.AdaptiveDetector;
import com.orbitalsky.detection.BaselineDetector;
import com.orbitalsky.detection.ImprovedDetector;
import com.orbitalsky.detection.StreakDetector;

/**
 * Detector selection and thresholds. Every field has a default, so a YAML file only needs the keys it changes.
 */
public class DetectionConfig {
    private DetectorType detector = DetectorType.ADAPTIVE;
    private double thresholdSigma = 5.0;
    private int lineHalfWidth = 3;
    private int improvedLineHalfWidth = 5;
    private int minStreakLength = 30;
    private double minAspectRatio = 3.0;
    private double percentile = 98.0;
    private int minRegionArea = 30;

    public DetectorType getDetector() {
        return detector;
    }

    public void setDetector(DetectorType detector) {
        this.detector = detector;
    }

    public double getThresholdSigma() {
        return thresholdSigma;
    }

    public void setThresholdSigma(double thresholdSigma) {
        this.thresholdSigma = thresholdSigma;
    }

    /**
     * @return pixels closer than this to a fitted line are flagged by the baseline detector
     */
    public int getLineHalfWidth() {
        return lineHalfWidth;
    }

    public void setLineHalfWidth(int lineHalfWidth) {
        this.lineHalfWidth = lineHalfWidth;
    }

    public int getImprovedLineHalfWidth() {
        return improvedLineHalfWidth;
    }

    public void setImprovedLineHalfWidth(int improvedLineHalfWidth) {
        this.improvedLineHalfWidth = improvedLineHalfWidth;
    }

    public int getMinStreakLength() {
        return minStreakLength;
    }

    public void setMinStreakLength(int minStreakLength) {
        this.minStreakLength = minStreakLength;
    }

    public double getMinAspectRatio() {
        return minAspectRatio;
    }

    public void setMinAspectRatio(double minAspectRatio) {
        this.minAspectRatio = minAspectRatio;
    }

    /**
     * @return brightness percentile (0-100) used by the adaptive detector
     */
    public double getPercentile() {
        return percentile;
    }

    public void setPercentile(double percentile) {
        this.percentile = percentile;
    }

    public int getMinRegionArea() {
        return minRegionArea;
    }

    public void setMinRegionArea(int minRegionArea) {
        this.minRegionArea = minRegionArea;
    }

    public StreakDetector createDetector() {
        return createDetector(detector);
    }

    public StreakDetector createDetector(DetectorType type) {
        switch (type) {
            case BASELINE:
                return new BaselineDetector(thresholdSigma, lineHalfWidth);
            case IMPROVED:
                return new ImprovedDetector(thresholdSigma, minStreakLength, minAspectRatio, improvedLineHalfWidth);
            case ADAPTIVE:
            default:
                return new AdaptiveDetector(percentile, minRegionArea, minAspectRatio);
        }
    }
}
