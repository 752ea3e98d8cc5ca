package com.orbitalsky.skyglow;

import com.orbitalsky.model.ObservationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Builds an {@link ObservationContext} from FITS header cards, trying the usual keyword variants
 * (SITELAT/LATITUDE, SITELONG/LONGITUD, ...). Unparseable values count as missing.
 */
public final class ObservationContextReader {
    private static final Logger logger = LoggerFactory.getLogger(ObservationContextReader.class);

    private ObservationContextReader() {
    }

    public static ObservationContext fromHeader(Map<String, String> header) {
        ObservationContext.Builder b = ObservationContext.builder();

        b.observationTime(parseDate(first(header, "DATE-OBS")));

        b.siteLatitude(parseAngle(first(header, "SITELAT", "LATITUDE")));
        b.siteLongitude(parseAngle(first(header, "SITELONG", "LONGITUD")));
        b.siteElevation(parseNumber(first(header, "SITEELEV", "ELEVATIO")));

        Double altitude = parseNumber(first(header, "ALTITUDE", "ALT"));
        Double zenithDistance = (altitude != null) ? 90.0 - altitude : null;
        b.zenithDistance(zenithDistance);

        Double airmass = parseNumber(first(header, "AIRMASS"));
        if (airmass == null && zenithDistance != null && zenithDistance < 70.0) {
            airmass = 1.0 / Math.cos(Math.toRadians(zenithDistance));
        }
        b.airmass(airmass);

        b.exposureTime(parseNumber(first(header, "EXPTIME", "EXPOSURE")));
        String filter = first(header, "FILTER", "FILTNAM");
        b.filter(filter == null || unquote(filter).isEmpty() ? null : unquote(filter));
        return b.build();
    }

    private static String first(Map<String, String> header, String... keys) {
        for (String k : keys) {
            String v = header.get(k);
            if (v != null && !v.trim().isEmpty()) return v.trim();
        }
        return null;
    }

    static Double parseNumber(String value) {
        if (value == null) return null;
        try {
            return Double.parseDouble(unquote(value));
        } catch (NumberFormatException e) {
            logger.debug("Ignoring non-numeric header value '{}'", value);
            return null;
        }
    }

    /** Decimal degrees, or sexagesimal "d m s" / "d:m:s" with the sign on the degrees. */
    static Double parseAngle(String value) {
        if (value == null) return null;
        String v = unquote(value);
        String[] parts = v.split("[\\s:]+");
        if (parts.length == 1) return parseNumber(v);
        try {
            double deg = Double.parseDouble(parts[0]);
            double min = parts.length > 1 ? Double.parseDouble(parts[1]) : 0;
            double sec = parts.length > 2 ? Double.parseDouble(parts[2]) : 0;
            double abs = Math.abs(deg) + min / 60.0 + sec / 3600.0;
            return parts[0].startsWith("-") ? -abs : abs;
        } catch (NumberFormatException e) {
            logger.debug("Ignoring malformed angle '{}'", value);
            return null;
        }
    }

    /** ISO date-time (optional fraction and trailing Z) or a bare date, taken as UTC. */
    static Instant parseDate(String value) {
        if (value == null) return null;
        String v = unquote(value);
        if (v.endsWith("Z")) v = v.substring(0, v.length() - 1);
        try {
            if (v.contains("T")) return LocalDateTime.parse(v).toInstant(ZoneOffset.UTC);
            return LocalDate.parse(v).atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            logger.debug("Ignoring unparseable DATE-OBS '{}'", value);
            return null;
        }
    }

    private static String unquote(String v) {
        String s = v.trim();
        if (s.length() >= 2 && s.startsWith("'") && s.endsWith("'")) s = s.substring(1, s.length() - 1).trim();
        return s;
    }
}
