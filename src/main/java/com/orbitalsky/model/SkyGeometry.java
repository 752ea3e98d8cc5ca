package com.orbitalsky.model;

/** Sun and Moon position for one instant and site, in degrees. */
public class SkyGeometry {
    public final double moonAltitude;
    public final double moonPhaseAngle; // 0 = nueva, 180 = llena
    public final double sunAltitude;

    public SkyGeometry(double moonAltitude, double moonPhaseAngle, double sunAltitude) {
        this.moonAltitude = moonAltitude;
        this.moonPhaseAngle = moonPhaseAngle;
        this.sunAltitude = sunAltitude;
    }
}
