package com.orbitalsky.detection;

import com.orbitalsky.model.DetectionMetadata;
import com.orbitalsky.model.Mask;
import ij.process.FloatProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.IntPredicate;

/**
 * Percentile threshold + shape filtering, without line fitting. The union of the bright regions that are large
 * and elongated enough is the mask. Default detector of the pipeline.
 */
public class AdaptiveDetector extends AbstractStreakDetector {
    private static final Logger logger = LoggerFactory.getLogger(AdaptiveDetector.class);

    public static final String METHOD = "AdaptiveDetector_Percentile";
    private static final double SMOOTH_SIGMA = 1.5;
    private static final int MIN_OBJECT_SIZE = 15;

    private final double percentile;
    private final int minRegionArea;
    private final double minAspectRatio;

    public AdaptiveDetector() {
        this(98.0, 30, 3.0);
    }

    public AdaptiveDetector(double percentile, int minRegionArea, double minAspectRatio) {
        if (percentile < 0 || percentile > 100) throw new IllegalArgumentException("percentile must be in [0, 100]");
        if (minAspectRatio <= 0) throw new IllegalArgumentException("minAspectRatio must be positive");
        this.percentile = percentile;
        this.minRegionArea = minRegionArea;
        this.minAspectRatio = minAspectRatio;
    }

    @Override
    public String name() {
        return METHOD;
    }

    @Override
    protected Map<String, Double> parameters() {
        Map<String, Double> p = new LinkedHashMap<>();
        p.put("percentile_threshold", percentile);
        p.put("min_region_area", (double) minRegionArea);
        p.put("min_aspect_ratio", minAspectRatio);
        return p;
    }

    @Override
    protected Mask run(FloatProcessor ip) {
        int w = ip.getWidth(), h = ip.getHeight();

        FloatProcessor smoothed = ImageOps.gaussian(ip, SMOOTH_SIGMA);
        double threshold = ImageOps.percentile(smoothed, percentile);
        boolean[] bright = ImageOps.above(smoothed, threshold);

        ParticleRegions regions = ParticleRegions.analyze(bright, w, h, MIN_OBJECT_SIZE);
        IntPredicate streak = r -> regions.area(r) >= minRegionArea && regions.minorAxis(r) > 0
                && regions.aspectRatio(r) >= minAspectRatio;
        boolean[] mask = regions.pixels(streak);
        int streaks = 0;
        for (int r = 0; r < regions.count(); r++) if (streak.test(r)) streaks++;
        logger.debug("threshold={} streaks={}", threshold, streaks);
        return Mask.fromProcessor(ImageOps.toByteProcessor(mask, w, h),
                DetectionMetadata.of(METHOD, parameters(), streaks));
    }
}
