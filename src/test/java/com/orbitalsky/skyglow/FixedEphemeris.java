package com.orbitalsky.skyglow;

import com.orbitalsky.model.SkyGeometry;

import java.time.Instant;

/** Same geometry for every instant and site. */
class FixedEphemeris implements SkyEphemeris {
    private final SkyGeometry geometry;

    FixedEphemeris(double moonAltitude, double moonPhaseAngle, double sunAltitude) {
        this.geometry = new SkyGeometry(moonAltitude, moonPhaseAngle, sunAltitude);
    }

    @Override
    public SkyGeometry geometry(Instant time, double latitude, double longitude) {
        return geometry;
    }
}
