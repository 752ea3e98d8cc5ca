package com.orbitalsky.model;

/** Observed-minus-natural comparison. Positive {@code odcMagnitudeDiff} means the sky is brighter than modeled. */
public class OdcResidual {
    public final double odcMagnitudeDiff;
    public final double odcPercentFlux;
    public final double observedBrightness;
    public final double naturalBrightness;
    public final boolean excessDueToOdc;
    public final SkyBrightness modelComponents;

    public OdcResidual(double odcMagnitudeDiff, double odcPercentFlux, double observedBrightness,
                       double naturalBrightness, boolean excessDueToOdc, SkyBrightness modelComponents) {
        this.odcMagnitudeDiff = odcMagnitudeDiff;
        this.odcPercentFlux = odcPercentFlux;
        this.observedBrightness = observedBrightness;
        this.naturalBrightness = naturalBrightness;
        this.excessDueToOdc = excessDueToOdc;
        this.modelComponents = modelComponents;
    }
}
