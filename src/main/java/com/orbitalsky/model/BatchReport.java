package com.orbitalsky.model;

import java.util.Collections;
import java.util.List;

public class BatchReport {
    public final String datasetId;
    public final List<FrameOutcome> outcomes;
    public final NightReport night;
    public final OdcResult odc;

    public BatchReport(String datasetId, List<FrameOutcome> outcomes, NightReport night, OdcResult odc) {
        this.datasetId = datasetId;
        this.outcomes = Collections.unmodifiableList(outcomes);
        this.night = night;
        this.odc = odc;
    }

    public long count(FrameOutcome.Status status) {
        return outcomes.stream().filter(o -> o.status == status).count();
    }
}
