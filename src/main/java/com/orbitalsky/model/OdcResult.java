package com.orbitalsky.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class OdcResult {
    public enum Status { OK, NO_VALID_DATA }

    public final Status status;
    public final String datasetId;
    public final OdcMethod method;
    public final double odcPercent;
    public final double percentileOdcPercent;
    public final double odcMagnitudeDiff;
    public final double[] odcCi95;
    public final double baselineLevel;
    public final double medianLevel;
    public final int framesUsed;
    public final int framesSkipped;
    public final OdcResidual physicalModel;
    public final String fallbackReason;

    public OdcResult(Status status, String datasetId, OdcMethod method, double odcPercent, double percentileOdcPercent,
                     double odcMagnitudeDiff, double[] odcCi95, double baselineLevel, double medianLevel,
                     int framesUsed, int framesSkipped, OdcResidual physicalModel, String fallbackReason) {
        this.status = status;
        this.datasetId = datasetId;
        this.method = method;
        this.odcPercent = odcPercent;
        this.percentileOdcPercent = percentileOdcPercent;
        this.odcMagnitudeDiff = odcMagnitudeDiff;
        this.odcCi95 = odcCi95.clone();
        this.baselineLevel = baselineLevel;
        this.medianLevel = medianLevel;
        this.framesUsed = framesUsed;
        this.framesSkipped = framesSkipped;
        this.physicalModel = physicalModel;
        this.fallbackReason = fallbackReason;
    }

    public static OdcResult noValidData(int framesSkipped) {
        return new OdcResult(Status.NO_VALID_DATA, null, OdcMethod.NONE, 0.0, 0.0, 0.0, new double[]{0.0, 0.0},
                Double.NaN, Double.NaN, 0, framesSkipped, null, "No valid background data");
    }

    public boolean hasData() { return status == Status.OK; }

    public OdcResult withDatasetId(String id) {
        return new OdcResult(status, id, method, odcPercent, percentileOdcPercent, odcMagnitudeDiff, odcCi95,
                baselineLevel, medianLevel, framesUsed, framesSkipped, physicalModel, fallbackReason);
    }
}
