package com.orbitalsky.detection;

import com.orbitalsky.model.Mask;
import ij.process.FloatProcessor;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AbstractStreakDetectorTest {

    static class FailingDetector extends AbstractStreakDetector {
        FloatProcessor seen;

        @Override
        public String name() {
            return "FailingDetector";
        }

        @Override
        protected Map<String, Double> parameters() {
            return Collections.singletonMap("k", 1.0);
        }

        @Override
        protected Mask run(FloatProcessor ip) {
            seen = ip;
            throw new IllegalStateException("accumulator overflow");
        }
    }

    @Test
    void internalFailureGivesEmptyDegradedMask() {
        Mask mask = new FailingDetector().detect(TestImages.flat(16, 12, 50));

        assertEquals(16, mask.width());
        assertEquals(12, mask.height());
        assertEquals(0, mask.contaminatedCount());
        assertTrue(mask.meta.degraded);
        assertEquals(0, mask.meta.detectedLines);
        assertEquals("FailingDetector", mask.meta.method);
        assertTrue(mask.meta.failureReason.contains("accumulator overflow"), mask.meta.failureReason);
        assertEquals(1.0, mask.meta.parameters.get("k").doubleValue());
    }

    @Test
    void subclassesOnlySeeFinitePixels() {
        double[][] img = TestImages.flat(4, 4, 10);
        img[1][2] = Double.NaN;
        img[3][0] = Double.POSITIVE_INFINITY;
        FailingDetector detector = new FailingDetector();

        detector.detect(img);

        assertEquals(10f, detector.seen.getf(2, 1), 0f);
        assertEquals(10f, detector.seen.getf(0, 3), 0f);
    }

    @Test
    void malformedInputIsNotContained() {
        assertThrows(IllegalArgumentException.class, () -> new FailingDetector().detect(new double[0][0]));
    }
}
