package com.orbitalsky.metrics;

import com.orbitalsky.model.DetectionMetadata;
import com.orbitalsky.model.FrameQuality;
import com.orbitalsky.model.NightReport;
import com.orbitalsky.model.QualityFlag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NightAggregatorTest {

    private static FrameQuality quality(double fraction, int streaks) {
        return new FrameQuality("f.fits", "UNKNOWN", fraction, streaks, FrameQualityService.severity(fraction),
                EnumSet.noneOf(QualityFlag.class), DetectionMetadata.of("test", Collections.emptyMap(), streaks));
    }

    @Test
    void emptyNightIsZeroed() {
        NightReport r = new NightAggregator().aggregate(Collections.emptyList(), "night-0");

        assertEquals("night-0", r.datasetId);
        assertEquals(0, r.nFrames);
        assertEquals(0, r.affectedFrames);
        assertEquals(0.0, r.medianStreakAreaFraction, 0.0);
        assertEquals(0.0, r.p95StreakAreaFraction, 0.0);
    }

    @Test
    void aggregatesFractionsAndHistogram() {
        List<FrameQuality> qs = new ArrayList<>();
        qs.add(quality(0.0, 0));
        qs.add(quality(0.01, 1));   // severidad 0.1
        qs.add(quality(0.03, 1));   // 0.3
        qs.add(quality(0.05, 2));   // 0.5
        qs.add(quality(0.2, 3));    // 1.0

        NightReport r = new NightAggregator().aggregate(qs, "night-1");

        assertEquals(5, r.nFrames);
        assertEquals(4, r.affectedFrames);
        assertEquals(0.03, r.medianStreakAreaFraction, 1e-12);
        assertEquals(0.05 + 0.8 * (0.2 - 0.05), r.p95StreakAreaFraction, 1e-12);
        assertEquals(2, r.severityHistogram.get("0-0.2").intValue());
        assertEquals(1, r.severityHistogram.get("0.2-0.4").intValue());
        assertEquals(1, r.severityHistogram.get("0.4-0.6").intValue());
        assertEquals(0, r.severityHistogram.get("0.6-0.8").intValue());
        assertEquals(1, r.severityHistogram.get("0.8-1.0").intValue());
    }

    @Test
    void histogramCountsSumToFrames() {
        List<FrameQuality> qs = new ArrayList<>();
        for (int i = 0; i <= 20; i++) qs.add(quality(i * 0.005, i % 2));

        NightReport r = new NightAggregator().aggregate(qs, "n");

        int sum = r.severityHistogram.values().stream().mapToInt(Integer::intValue).sum();
        assertEquals(qs.size(), sum);
        assertEquals(5, r.severityHistogram.size());
    }
}
