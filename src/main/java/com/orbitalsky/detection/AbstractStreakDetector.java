package com.orbitalsky.detection;

import com.orbitalsky.model.DetectionMetadata;
import com.orbitalsky.model.Mask;
import ij.process.FloatProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Shape checks, pixel sanitizing and failure containment shared by all detectors. Subclasses only see a
 * finite-valued FloatProcessor; anything they throw becomes an empty, degraded mask.
 */
public abstract class AbstractStreakDetector implements StreakDetector {
    private static final Logger logger = LoggerFactory.getLogger(AbstractStreakDetector.class);

    @Override
    public final Mask detect(double[][] image) {
        FloatProcessor ip = ImageOps.toSanitizedProcessor(image);
        try {
            return run(ip);
        } catch (RuntimeException e) {
            logger.warn("{} failed, returning empty mask: {}", name(), e.toString());
            return Mask.empty(ip.getWidth(), ip.getHeight(), DetectionMetadata.failed(name(), parameters(), e.toString()));
        }
    }

    protected abstract Mask run(FloatProcessor ip);

    /** Parameters echoed into the mask metadata. */
    protected abstract Map<String, Double> parameters();
}
