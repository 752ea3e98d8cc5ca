package com.orbitalsky.detection;

import com.orbitalsky.model.Mask;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BaselineDetectorTest {

    @Test
    void findsSingleHorizontalStreak() {
        double[][] img = TestImages.withHorizontalStreak(TestImages.flat(128, 128, 100), 63, 3, 0, 128, 5000);

        Mask mask = new BaselineDetector(5.0, 3).detect(img);

        assertEquals(1, mask.meta.detectedLines);
        assertFalse(mask.meta.degraded);
        assertEquals(BaselineDetector.METHOD, mask.meta.method);
        for (int y = 63; y <= 65; y++) {
            for (int x = 0; x < 128; x++) assertTrue(mask.isContaminated(x, y), "row " + y + " col " + x);
        }
        assertFalse(mask.isContaminated(64, 20));
        assertFalse(mask.isContaminated(64, 110));
    }

    @Test
    void diagonalSegmentIsOneLine() {
        double[][] img = TestImages.withSegment(TestImages.flat(128, 128, 100), 20, 20, 110, 110, 1.5, 5000);

        Mask mask = new BaselineDetector().detect(img);

        assertEquals(1, mask.meta.detectedLines);
        assertTrue(mask.isContaminated(65, 65));
        assertTrue(mask.isContaminated(30, 30));
        assertFalse(mask.isContaminated(20, 110));
        assertFalse(mask.isContaminated(110, 20));
    }

    @Test
    void shallowSegmentIsOneLine() {
        double[][] img = TestImages.withSegment(TestImages.flat(128, 128, 100), 20, 30, 100, 90, 2, 5000);

        Mask mask = new BaselineDetector().detect(img);

        assertEquals(1, mask.meta.detectedLines);
        assertTrue(mask.isContaminated(60, 60));
        assertFalse(mask.isContaminated(100, 20));
    }

    @Test
    void flatFrameHasNoLines() {
        Mask mask = new BaselineDetector().detect(TestImages.flat(64, 64, 250));

        assertEquals(0, mask.meta.detectedLines);
        assertEquals(0, mask.contaminatedCount());
        assertEquals(64, mask.width());
        assertEquals(64, mask.height());
    }

    @Test
    void reportsParameters() {
        Mask mask = new BaselineDetector(4.0, 2).detect(TestImages.flat(32, 32, 10));

        assertEquals(4.0, mask.meta.parameters.get("threshold_sigma").doubleValue());
        assertEquals(2.0, mask.meta.parameters.get("line_half_width").doubleValue());
    }

    @Test
    void rejectsJaggedImage() {
        double[][] jagged = {new double[10], new double[9]};
        assertThrows(IllegalArgumentException.class, () -> new BaselineDetector().detect(jagged));
    }

    @Test
    void rejectsEmptyImage() {
        assertThrows(IllegalArgumentException.class, () -> new BaselineDetector().detect(new double[0][0]));
    }

    @Test
    void nonFinitePixelsDoNotBreakDetection() {
        double[][] img = TestImages.flat(64, 64, 100);
        img[10][10] = Double.NaN;
        img[20][30] = Double.POSITIVE_INFINITY;

        Mask mask = new BaselineDetector().detect(img);

        assertEquals(64, mask.width());
        assertFalse(mask.meta.degraded);
        assertEquals(0, mask.meta.detectedLines);
    }
}
