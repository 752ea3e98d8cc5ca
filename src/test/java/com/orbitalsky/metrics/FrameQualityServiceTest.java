package com.orbitalsky.metrics;

import com.orbitalsky.model.DetectionMetadata;
import com.orbitalsky.model.Frame;
import com.orbitalsky.model.FrameQuality;
import com.orbitalsky.model.Mask;
import com.orbitalsky.model.QualityFlag;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class FrameQualityServiceTest {

    private final FrameQualityService service = new FrameQualityService();

    private static Mask maskWithRows(int w, int h, int rows, int lines) {
        Mask m = Mask.empty(w, h, DetectionMetadata.of("test", Collections.emptyMap(), lines));
        for (int y = 0; y < rows; y++) java.util.Arrays.fill(m.pixels[y], (byte) 1);
        return m;
    }

    @Test
    void cleanFrameHasNoFlags() {
        Frame frame = new Frame(new double[10][10], "/data/night1/a.fits");

        FrameQuality q = service.compute(frame, maskWithRows(10, 10, 0, 0));

        assertEquals(0.0, q.streakAreaFraction, 0.0);
        assertEquals(0.0, q.severityScore, 0.0);
        assertTrue(q.flags.isEmpty());
        assertEquals("a.fits", q.file);
        assertEquals("UNKNOWN", q.timestampUtc);
    }

    @Test
    void smallStreakIsFlaggedButNotHighContamination() {
        Frame frame = new Frame(new double[100][100], null, "b.fits", "2024-03-10T03:00:00");

        FrameQuality q = service.compute(frame, maskWithRows(100, 100, 3, 1));

        assertEquals(0.03, q.streakAreaFraction, 1e-12);
        assertEquals(0.3, q.severityScore, 1e-12);
        assertEquals(1, q.numStreaks);
        assertTrue(q.flags.contains(QualityFlag.STREAK_DETECTED));
        assertFalse(q.flags.contains(QualityFlag.HIGH_CONTAMINATION));
        assertEquals("2024-03-10T03:00:00", q.timestampUtc);
    }

    @Test
    void heavyContaminationSaturatesSeverity() {
        Frame frame = new Frame(new double[10][10], "c.fits");

        FrameQuality q = service.compute(frame, maskWithRows(10, 10, 4, 2));

        assertEquals(0.4, q.streakAreaFraction, 1e-12);
        assertEquals(1.0, q.severityScore, 0.0);
        assertTrue(q.flags.contains(QualityFlag.HIGH_CONTAMINATION));
    }

    @Test
    void exactlyFivePercentIsNotHighContamination() {
        Frame frame = new Frame(new double[20][20], "d.fits");
        Mask m = maskWithRows(20, 20, 1, 1);

        FrameQuality q = service.compute(frame, m);

        assertEquals(0.05, q.streakAreaFraction, 1e-12);
        assertFalse(q.flags.contains(QualityFlag.HIGH_CONTAMINATION));
    }

    @Test
    void maskPixelsWithoutLinesDoNotSetStreakFlag() {
        Frame frame = new Frame(new double[10][10], "e.fits");

        FrameQuality q = service.compute(frame, maskWithRows(10, 10, 1, 0));

        assertFalse(q.flags.contains(QualityFlag.STREAK_DETECTED));
        assertEquals(0.1, q.streakAreaFraction, 1e-12);
    }

    @Test
    void shapeMismatchIsRejected() {
        Frame frame = new Frame(new double[10][10], "f.fits");
        assertThrows(IllegalArgumentException.class, () -> service.compute(frame, maskWithRows(10, 9, 0, 0)));
    }
}
