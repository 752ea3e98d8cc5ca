package com.orbitalsky.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public class FrameQuality {
    public final String file;
    public final String timestampUtc;
    public final double streakAreaFraction; // [0,1]
    public final int numStreaks;
    public final double severityScore;      // [0,1]
    public final Set<QualityFlag> flags;
    public final DetectionMetadata detector;

    public FrameQuality(String file, String timestampUtc, double streakAreaFraction, int numStreaks,
                        double severityScore, Set<QualityFlag> flags, DetectionMetadata detector) {
        this.file = file;
        this.timestampUtc = timestampUtc;
        this.streakAreaFraction = streakAreaFraction;
        this.numStreaks = numStreaks;
        this.severityScore = severityScore;
        this.flags = flags.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(flags));
        this.detector = detector;
    }
}
