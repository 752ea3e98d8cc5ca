package com.orbitalsky.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class NightReport {
    public final String datasetId;
    public final int nFrames;
    public final int affectedFrames;
    public final double medianStreakAreaFraction;
    public final double p95StreakAreaFraction;
    public final Map<String, Integer> severityHistogram;

    public NightReport(String datasetId, int nFrames, int affectedFrames, double medianStreakAreaFraction,
                       double p95StreakAreaFraction, Map<String, Integer> severityHistogram) {
        this.datasetId = datasetId;
        this.nFrames = nFrames;
        this.affectedFrames = affectedFrames;
        this.medianStreakAreaFraction = medianStreakAreaFraction;
        this.p95StreakAreaFraction = p95StreakAreaFraction;
        this.severityHistogram = Collections.unmodifiableMap(new LinkedHashMap<>(severityHistogram));
    }

    public static NightReport empty(String datasetId) {
        return new NightReport(datasetId, 0, 0, 0.0, 0.0, Collections.emptyMap());
    }
}
