package com.orbitalsky.validation;

import com.orbitalsky.model.DetectionMetrics;
import com.orbitalsky.model.Mask;
import com.orbitalsky.model.PixelMetrics;
import com.orbitalsky.model.ValidationSummary;
import com.orbitalsky.utils.Stats;

import java.util.List;

/**
 * Pixel-level comparison of predicted and ground-truth masks, per frame and across a dataset.
 */
public final class DetectionEvaluator {

    private DetectionEvaluator() {
    }

    /** Intersection over union of the non-zero pixels. Two empty masks agree perfectly (1.0). */
    public static double iou(Mask pred, Mask gt) {
        requireSameShape(pred, gt);
        long inter = 0, union = 0;
        for (int y = 0; y < pred.height(); y++) {
            for (int x = 0; x < pred.width(); x++) {
                boolean p = pred.pixels[y][x] != 0, g = gt.pixels[y][x] != 0;
                if (p && g) inter++;
                if (p || g) union++;
            }
        }
        if (union == 0) return 1.0;
        return (double) inter / union;
    }

    public static PixelMetrics pixelMetrics(Mask pred, Mask gt) {
        requireSameShape(pred, gt);
        long tp = 0, fp = 0, fn = 0, tn = 0;
        for (int y = 0; y < pred.height(); y++) {
            for (int x = 0; x < pred.width(); x++) {
                boolean p = pred.pixels[y][x] != 0, g = gt.pixels[y][x] != 0;
                if (p && g) tp++;
                else if (p) fp++;
                else if (g) fn++;
                else tn++;
            }
        }
        return new PixelMetrics(tp, fp, fn, tn);
    }

    public static DetectionMetrics evaluateFrame(Mask pred, Mask gt, int numGtStreaks, int numPredStreaks) {
        return new DetectionMetrics(iou(pred, gt), pixelMetrics(pred, gt), numGtStreaks, numPredStreaks);
    }

    /** Uses the streak counts carried by each mask's metadata. */
    public static DetectionMetrics evaluateFrame(Mask pred, Mask gt) {
        return evaluateFrame(pred, gt, gt.meta.detectedLines, pred.meta.detectedLines);
    }

    public static ValidationSummary aggregate(List<DetectionMetrics> metrics) {
        if (metrics.isEmpty()) return ValidationSummary.empty();
        int n = metrics.size();
        double[] ious = new double[n], precisions = new double[n], recalls = new double[n], f1s = new double[n];
        long tp = 0, fp = 0, fn = 0;
        for (int i = 0; i < n; i++) {
            DetectionMetrics m = metrics.get(i);
            ious[i] = m.iou;
            precisions[i] = m.precision;
            recalls[i] = m.recall;
            f1s[i] = m.f1Score;
            tp += m.truePositives;
            fp += m.falsePositives;
            fn += m.falseNegatives;
        }
        return new ValidationSummary(n, Stats.mean(ious), Stats.std(ious), Stats.median(ious),
                Stats.mean(precisions), Stats.mean(recalls), Stats.mean(f1s), tp, fp, fn);
    }

    private static void requireSameShape(Mask a, Mask b) {
        if (a.width() != b.width() || a.height() != b.height()) {
            throw new IllegalArgumentException(String.format("Mask shapes differ: %dx%d vs %dx%d",
                    a.width(), a.height(), b.width(), b.height()));
        }
    }
}
