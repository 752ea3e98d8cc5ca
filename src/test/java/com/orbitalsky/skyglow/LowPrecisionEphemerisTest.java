package com.orbitalsky.skyglow;

import com.orbitalsky.model.SkyGeometry;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class LowPrecisionEphemerisTest {

    private final LowPrecisionEphemeris ephemeris = new LowPrecisionEphemeris();

    @Test
    void fullMoonHasPhaseNearOneEighty() {
        SkyGeometry g = ephemeris.geometry(Instant.parse("2024-01-25T17:54:00Z"), -30.24, -70.74);
        assertTrue(g.moonPhaseAngle > 170, "phase " + g.moonPhaseAngle);
    }

    @Test
    void newMoonHasPhaseNearZero() {
        SkyGeometry g = ephemeris.geometry(Instant.parse("2024-01-11T11:57:00Z"), -30.24, -70.74);
        assertTrue(g.moonPhaseAngle < 10, "phase " + g.moonPhaseAngle);
    }

    @Test
    void equinoxNoonSunIsNearZenithOnEquator() {
        SkyGeometry g = ephemeris.geometry(Instant.parse("2024-03-20T12:00:00Z"), 0, 0);
        assertTrue(g.sunAltitude > 80, "sun " + g.sunAltitude);
    }

    @Test
    void equinoxMidnightSunIsNearNadirOnEquator() {
        SkyGeometry g = ephemeris.geometry(Instant.parse("2024-03-20T00:00:00Z"), 0, 0);
        assertTrue(g.sunAltitude < -80, "sun " + g.sunAltitude);
    }

    @Test
    void anglesStayInRange() {
        Instant t = Instant.parse("2023-07-01T00:00:00Z");
        for (int h = 0; h < 48; h++) {
            SkyGeometry g = ephemeris.geometry(t.plusSeconds(h * 1800L), 48.0, 11.0);
            assertTrue(g.moonAltitude >= -90 && g.moonAltitude <= 90);
            assertTrue(g.sunAltitude >= -90 && g.sunAltitude <= 90);
            assertTrue(g.moonPhaseAngle >= 0 && g.moonPhaseAngle <= 180);
        }
    }
}
