package com.orbitalsky.skyglow;

import com.orbitalsky.model.SkyGeometry;

import java.time.Instant;

/** Sun and Moon positions as seen from a site. */
public interface SkyEphemeris {

    /**
     * @param latitude  degrees, north positive
     * @param longitude degrees, east positive
     */
    SkyGeometry geometry(Instant time, double latitude, double longitude);
}
