package com.orbitalsky.metrics;

import com.orbitalsky.model.FrameQuality;
import com.orbitalsky.model.NightReport;
import com.orbitalsky.utils.Stats;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class NightAggregator {

    private static final double[] EDGES = {0.0, 0.2, 0.4, 0.6, 0.8, 1.01};
    private static final String[] LABELS = {"0-0.2", "0.2-0.4", "0.4-0.6", "0.6-0.8", "0.8-1.0"};

    public NightReport aggregate(List<FrameQuality> qualities, String datasetId) {
        if (qualities.isEmpty()) return NightReport.empty(datasetId);

        double[] fractions = new double[qualities.size()];
        int affected = 0;
        Map<String, Integer> histogram = new LinkedHashMap<>();
        for (String label : LABELS) histogram.put(label, 0);

        for (int i = 0; i < qualities.size(); i++) {
            FrameQuality q = qualities.get(i);
            fractions[i] = q.streakAreaFraction;
            if (q.numStreaks > 0) affected++;
            int bucket = bucket(q.severityScore);
            if (bucket >= 0) histogram.merge(LABELS[bucket], 1, Integer::sum);
        }

        return new NightReport(datasetId, qualities.size(), affected,
                Stats.median(fractions), Stats.percentile(fractions, 95), histogram);
    }

    private static int bucket(double severity) {
        for (int b = 0; b < LABELS.length; b++) {
            if (severity >= EDGES[b] && severity < EDGES[b + 1]) return b;
        }
        return -1;
    }
}
