package com.orbitalsky.metrics;

import com.orbitalsky.model.Frame;
import com.orbitalsky.model.FrameQuality;
import com.orbitalsky.model.Mask;
import com.orbitalsky.model.QualityFlag;

import java.util.EnumSet;

public class FrameQualityService {

    public static final double HIGH_CONTAMINATION_FRACTION = 0.05;
    private static final double SEVERITY_SCALE = 10.0;

    public FrameQuality compute(Frame frame, Mask mask) {
        if (mask.width() != frame.width() || mask.height() != frame.height()) {
            throw new IllegalArgumentException(String.format("Mask %dx%d does not match frame %dx%d",
                    mask.width(), mask.height(), frame.width(), frame.height()));
        }
        long total = frame.pixelCount();
        double fraction = total > 0 ? (double) mask.contaminatedCount() / total : 0.0;
        int streaks = mask.meta.detectedLines;

        EnumSet<QualityFlag> flags = EnumSet.noneOf(QualityFlag.class);
        if (streaks > 0) flags.add(QualityFlag.STREAK_DETECTED);
        if (fraction > HIGH_CONTAMINATION_FRACTION) flags.add(QualityFlag.HIGH_CONTAMINATION);

        String timestamp = frame.timestampUtc != null ? frame.timestampUtc : "UNKNOWN";
        return new FrameQuality(frame.fileName(), timestamp, fraction, streaks, severity(fraction), flags, mask.meta);
    }

    /** Linear in the contaminated fraction, saturating at 1 from 10% coverage on. */
    public static double severity(double areaFraction) {
        return Math.min(areaFraction * SEVERITY_SCALE, 1.0);
    }
}
