package com.orbitalsky.detection;

import com.orbitalsky.model.DetectionMetadata;
import com.orbitalsky.model.Mask;
import ij.process.FloatProcessor;
import ij.process.ImageStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Global statistics + Canny + Hough. Edge thresholds come from the frame mean and standard deviation;
 * every Hough peak holding at least 30% of the strongest peak's votes becomes a line of the mask.
 */
public class BaselineDetector extends AbstractStreakDetector {
    private static final Logger logger = LoggerFactory.getLogger(BaselineDetector.class);

    public static final String METHOD = "BaselineDetector_Hough";
    private static final double EDGE_SIGMA = 2.0;
    private static final double PEAK_FRACTION = 0.3;

    private final double thresholdSigma;
    private final int lineHalfWidth;

    public BaselineDetector() {
        this(5.0, 3);
    }

    public BaselineDetector(double thresholdSigma, int lineHalfWidth) {
        if (thresholdSigma < 0) throw new IllegalArgumentException("thresholdSigma must be non-negative");
        if (lineHalfWidth <= 0) throw new IllegalArgumentException("lineHalfWidth must be positive");
        this.thresholdSigma = thresholdSigma;
        this.lineHalfWidth = lineHalfWidth;
    }

    @Override
    public String name() {
        return METHOD;
    }

    @Override
    protected Map<String, Double> parameters() {
        Map<String, Double> p = new LinkedHashMap<>();
        p.put("threshold_sigma", thresholdSigma);
        p.put("line_half_width", (double) lineHalfWidth);
        return p;
    }

    @Override
    protected Mask run(FloatProcessor ip) {
        int w = ip.getWidth(), h = ip.getHeight();

        // --- ESTADÍSTICA GLOBAL ---
        ImageStatistics stats = ip.getStatistics();
        double mean = stats.mean;
        double std = stats.stdDev;
        logger.debug("mean={} std={} bright threshold={}", mean, std, mean + thresholdSigma * std);

        // --- BORDES + HOUGH ---
        boolean[] edges = new CannyEdgeDetector(EDGE_SIGMA, mean + 2 * std, mean + 5 * std).detect(ip);
        HoughLineTransform hough = new HoughLineTransform();
        HoughLineTransform.Accumulator acc = hough.accumulate(edges, w, h);
        int max = acc.max();
        if (max == 0) {
            return Mask.empty(w, h, DetectionMetadata.of(METHOD, parameters(), 0));
        }

        List<HoughLine> lines = hough.peaks(acc, PEAK_FRACTION * max, Integer.MAX_VALUE);
        logger.debug("{} Hough peaks above {} votes", lines.size(), PEAK_FRACTION * max);
        boolean[] mask = HoughLineTransform.rasterize(lines, w, h, lineHalfWidth);
        return Mask.fromProcessor(ImageOps.toByteProcessor(mask, w, h),
                DetectionMetadata.of(METHOD, parameters(), lines.size()));
    }
}
