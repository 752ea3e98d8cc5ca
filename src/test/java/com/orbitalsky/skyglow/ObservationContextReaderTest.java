package com.orbitalsky.skyglow;

import com.orbitalsky.model.ObservationContext;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ObservationContextReaderTest {

    @Test
    void readsStandardKeywords() {
        Map<String, String> h = new HashMap<>();
        h.put("DATE-OBS", "2024-03-10T03:15:30.5");
        h.put("SITELAT", "-30.24");
        h.put("SITELONG", "-70.74");
        h.put("SITEELEV", "2200");
        h.put("ALTITUDE", "60");
        h.put("EXPTIME", "30");
        h.put("FILTER", "'V       '");

        ObservationContext ctx = ObservationContextReader.fromHeader(h);

        assertTrue(ctx.hasMetadata);
        assertEquals(Instant.parse("2024-03-10T03:15:30.500Z"), ctx.observationTime);
        assertEquals(-30.24, ctx.siteLatitude, 1e-12);
        assertEquals(-70.74, ctx.siteLongitude, 1e-12);
        assertEquals(2200.0, ctx.siteElevation, 1e-12);
        assertEquals(30.0, ctx.zenithDistance, 1e-9);
        assertEquals(1.0 / Math.cos(Math.toRadians(30)), ctx.airmass, 1e-9);
        assertEquals(30.0, ctx.exposureTime, 1e-12);
        assertEquals("V", ctx.filter);
    }

    @Test
    void acceptsAlternateKeywordsAndSexagesimal() {
        Map<String, String> h = new HashMap<>();
        h.put("LATITUDE", "-30 14 24");
        h.put("LONGITUD", "-70:44:24");
        h.put("ALT", "45");
        h.put("AIRMASS", "1.5");
        h.put("EXPOSURE", "12.5");
        h.put("FILTNAM", "R");

        ObservationContext ctx = ObservationContextReader.fromHeader(h);

        assertEquals(-30.24, ctx.siteLatitude, 1e-9);
        assertEquals(-70.74, ctx.siteLongitude, 1e-9);
        assertEquals(45.0, ctx.zenithDistance, 1e-9);
        assertEquals(1.5, ctx.airmass, 1e-12);
        assertEquals(12.5, ctx.exposureTime, 1e-12);
        assertEquals("R", ctx.filter);
        assertNull(ctx.observationTime);
        assertTrue(ctx.hasMetadata);
    }

    @Test
    void dateVariants() {
        assertEquals(Instant.parse("2024-03-10T03:00:00Z"),
                ObservationContextReader.fromHeader(Collections.singletonMap("DATE-OBS", "2024-03-10T03:00:00Z")).observationTime);
        assertEquals(Instant.parse("2024-03-10T00:00:00Z"),
                ObservationContextReader.fromHeader(Collections.singletonMap("DATE-OBS", "2024-03-10")).observationTime);
        assertNull(ObservationContextReader.fromHeader(Collections.singletonMap("DATE-OBS", "yesterday")).observationTime);
    }

    @Test
    void lowPointingLeavesAirmassUnset() {
        ObservationContext ctx = ObservationContextReader.fromHeader(Collections.singletonMap("ALTITUDE", "15"));

        assertEquals(75.0, ctx.zenithDistance, 1e-9);
        assertNull(ctx.airmass);
        assertEquals(1.0, ctx.airmassOrDefault(), 0.0);
    }

    @Test
    void emptyHeaderHasNoMetadata() {
        ObservationContext ctx = ObservationContextReader.fromHeader(Collections.emptyMap());

        assertFalse(ctx.hasMetadata);
        assertEquals(0.0, ctx.latitudeOrDefault(), 0.0);
        assertEquals(0.0, ctx.exposureOrDefault(), 0.0);
        assertEquals("Unknown", ctx.filterOrDefault());
    }

    @Test
    void garbageNumbersAreIgnored() {
        Map<String, String> h = new HashMap<>();
        h.put("EXPTIME", "long");
        h.put("SITELAT", "north");

        ObservationContext ctx = ObservationContextReader.fromHeader(h);

        assertNull(ctx.exposureTime);
        assertNull(ctx.siteLatitude);
        assertFalse(ctx.hasMetadata);
    }
}
