package com.orbitalsky.detection;

import com.orbitalsky.model.DetectionMetadata;
import com.orbitalsky.model.Mask;
import ij.process.FloatProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntPredicate;

/**
 * Local threshold + shape filtering + Hough restricted to the elongated regions.
 * <p>
 * The local threshold is a Gaussian-weighted neighbourhood mean (51 px block) raised by 5, which follows
 * vignetting and sky gradients. Connected regions that are long and thin enough form the elongation mask;
 * Hough lines found on its edges become the result. When Hough finds nothing but the shape filter kept
 * at least one region, the elongation mask itself is returned.
 */
public class ImprovedDetector extends AbstractStreakDetector {
    private static final Logger logger = LoggerFactory.getLogger(ImprovedDetector.class);

    public static final String METHOD = "ImprovedDetector_Morphology+Hough";
    static final double SMOOTH_SIGMA = 1.0;
    private static final int BLOCK_SIZE = 51;
    private static final double BLOCK_OFFSET = -5.0;
    private static final int MIN_OBJECT_SIZE = 20;
    private static final double EDGE_SIGMA = 1.5;
    private static final double EDGE_LOW = 0.1;
    private static final double EDGE_HIGH = 0.2;
    private static final double PEAK_FRACTION = 0.15;
    private static final int MAX_PEAKS = 10;

    private final double thresholdSigma;
    private final int minStreakLength;
    private final double minAspectRatio;
    private final int lineHalfWidth;
    private final CannyEdgeDetector edgeDetector;

    public ImprovedDetector() {
        this(3.0, 30, 3.0, 5);
    }

    public ImprovedDetector(double thresholdSigma, int minStreakLength, double minAspectRatio, int lineHalfWidth) {
        this(thresholdSigma, minStreakLength, minAspectRatio, lineHalfWidth,
                new CannyEdgeDetector(EDGE_SIGMA, EDGE_LOW, EDGE_HIGH));
    }

    ImprovedDetector(double thresholdSigma, int minStreakLength, double minAspectRatio, int lineHalfWidth,
                     CannyEdgeDetector edgeDetector) {
        if (thresholdSigma < 0) throw new IllegalArgumentException("thresholdSigma must be non-negative");
        if (minAspectRatio <= 0) throw new IllegalArgumentException("minAspectRatio must be positive");
        if (lineHalfWidth <= 0) throw new IllegalArgumentException("lineHalfWidth must be positive");
        this.thresholdSigma = thresholdSigma;
        this.minStreakLength = minStreakLength;
        this.minAspectRatio = minAspectRatio;
        this.lineHalfWidth = lineHalfWidth;
        this.edgeDetector = edgeDetector;
    }

    /** Elongated bright regions and how many there are. */
    static class Elongation {
        final boolean[] mask;
        final int candidates;

        Elongation(boolean[] mask, int candidates) {
            this.mask = mask;
            this.candidates = candidates;
        }
    }

    @Override
    public String name() {
        return METHOD;
    }

    @Override
    protected Map<String, Double> parameters() {
        Map<String, Double> p = new LinkedHashMap<>();
        p.put("threshold_sigma", thresholdSigma);
        p.put("min_streak_length", (double) minStreakLength);
        p.put("min_aspect_ratio", minAspectRatio);
        p.put("line_half_width", (double) lineHalfWidth);
        return p;
    }

    @Override
    protected Mask run(FloatProcessor ip) {
        int w = ip.getWidth(), h = ip.getHeight();

        FloatProcessor smoothed = ImageOps.gaussian(ip, SMOOTH_SIGMA);
        Elongation elongation = elongated(smoothed);
        boolean[] elongated = elongation.mask;
        int candidates = elongation.candidates;

        // --- HOUGH SOBRE BORDES ALARGADOS ---
        boolean[] edges = HoughLineTransform.and(edgeDetector.detect(smoothed), elongated);
        List<HoughLine> lines = Collections.emptyList();
        if (HoughLineTransform.any(edges)) {
            lines = findLines(edges, w, h);
        }

        if (lines.isEmpty() && candidates > 0) {
            logger.debug("Using morphological fallback: {} streaks", candidates);
            return Mask.fromProcessor(ImageOps.toByteProcessor(elongated, w, h),
                    DetectionMetadata.withCandidates(METHOD, parameters(), candidates, candidates));
        }
        boolean[] mask = HoughLineTransform.rasterize(lines, w, h, lineHalfWidth);
        return Mask.fromProcessor(ImageOps.toByteProcessor(mask, w, h),
                DetectionMetadata.withCandidates(METHOD, parameters(), lines.size(), candidates));
    }

    Elongation elongated(FloatProcessor smoothed) {
        int w = smoothed.getWidth(), h = smoothed.getHeight();

        // --- UMBRAL LOCAL ---
        FloatProcessor local = ImageOps.gaussian(smoothed, (BLOCK_SIZE - 1) / 6.0);
        local.add(-BLOCK_OFFSET);
        boolean[] bright = ImageOps.above(smoothed, local);

        // --- FILTRO MORFOLÓGICO ---
        ParticleRegions regions = ParticleRegions.analyze(bright, w, h, MIN_OBJECT_SIZE);
        IntPredicate streak = r -> regions.minorAxis(r) > 0 && regions.aspectRatio(r) >= minAspectRatio
                && regions.majorAxis(r) >= minStreakLength;
        int candidates = 0;
        for (int r = 0; r < regions.count(); r++) if (streak.test(r)) candidates++;
        return new Elongation(regions.pixels(streak), candidates);
    }

    private List<HoughLine> findLines(boolean[] edges, int w, int h) {
        try {
            HoughLineTransform hough = new HoughLineTransform();
            HoughLineTransform.Accumulator acc = hough.accumulate(edges, w, h);
            int max = acc.max();
            if (max == 0) return Collections.emptyList();
            return hough.peaks(acc, PEAK_FRACTION * max, MAX_PEAKS);
        } catch (RuntimeException e) {
            logger.warn("Hough transform failed: {}", e.toString());
            return Collections.emptyList();
        }
    }
}
