package com.orbitalsky.model;

/** Modeled natural sky brightness in mag/arcsec², total and per physical source. */
public class SkyBrightness {
    public final double totalSkyBrightness;
    public final double lunarComponent;
    public final double rayleighComponent;
    public final double twilightComponent;
    public final double moonAltitude;
    public final double moonPhaseAngle;
    public final double sunAltitude;
    public final double zenithDistance;
    public final String modelVersion;

    public SkyBrightness(double totalSkyBrightness, double lunarComponent, double rayleighComponent,
                         double twilightComponent, SkyGeometry geometry, double zenithDistance, String modelVersion) {
        this.totalSkyBrightness = totalSkyBrightness;
        this.lunarComponent = lunarComponent;
        this.rayleighComponent = rayleighComponent;
        this.twilightComponent = twilightComponent;
        this.moonAltitude = geometry.moonAltitude;
        this.moonPhaseAngle = geometry.moonPhaseAngle;
        this.sunAltitude = geometry.sunAltitude;
        this.zenithDistance = zenithDistance;
        this.modelVersion = modelVersion;
    }
}
