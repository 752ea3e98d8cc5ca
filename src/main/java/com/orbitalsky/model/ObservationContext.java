package com.orbitalsky.model;

import java.time.Instant;

/**
 * Observing conditions pulled from a frame header. Every field may be missing; the {@code ...OrDefault()}
 * accessors apply the fallbacks used by the sky model (equator, sea level, zenith pointing, airmass 1).
 */
public class ObservationContext {
    public static final double DEFAULT_LATITUDE = 0.0;
    public static final double DEFAULT_LONGITUDE = 0.0;
    public static final double DEFAULT_ELEVATION_M = 0.0;
    public static final double DEFAULT_ZENITH_DISTANCE = 0.0;
    public static final double DEFAULT_AIRMASS = 1.0;
    public static final double DEFAULT_EXPOSURE = 0.0;
    public static final String DEFAULT_FILTER = "Unknown";

    public final Double siteLatitude;
    public final Double siteLongitude;
    public final Double siteElevation;
    public final Double zenithDistance;
    public final Double airmass;
    public final String filter;
    public final Double exposureTime;
    public final Instant observationTime;
    public final boolean hasMetadata;

    private ObservationContext(Builder b) {
        this.siteLatitude = b.siteLatitude;
        this.siteLongitude = b.siteLongitude;
        this.siteElevation = b.siteElevation;
        this.zenithDistance = b.zenithDistance;
        this.airmass = b.airmass;
        this.filter = b.filter;
        this.exposureTime = b.exposureTime;
        this.observationTime = b.observationTime;
        this.hasMetadata = observationTime != null || siteLatitude != null || zenithDistance != null;
    }

    public static Builder builder() { return new Builder(); }

    public static ObservationContext none() { return new Builder().build(); }

    public double latitudeOrDefault() { return siteLatitude != null ? siteLatitude : DEFAULT_LATITUDE; }
    public double longitudeOrDefault() { return siteLongitude != null ? siteLongitude : DEFAULT_LONGITUDE; }
    public double elevationOrDefault() { return siteElevation != null ? siteElevation : DEFAULT_ELEVATION_M; }
    public double zenithDistanceOrDefault() { return zenithDistance != null ? zenithDistance : DEFAULT_ZENITH_DISTANCE; }
    public double airmassOrDefault() { return airmass != null ? airmass : DEFAULT_AIRMASS; }
    public double exposureOrDefault() { return exposureTime != null ? exposureTime : DEFAULT_EXPOSURE; }
    public String filterOrDefault() { return filter != null ? filter : DEFAULT_FILTER; }

    public static class Builder {
        private Double siteLatitude;
        private Double siteLongitude;
        private Double siteElevation;
        private Double zenithDistance;
        private Double airmass;
        private String filter;
        private Double exposureTime;
        private Instant observationTime;

        public Builder siteLatitude(Double v) { this.siteLatitude = v; return this; }
        public Builder siteLongitude(Double v) { this.siteLongitude = v; return this; }
        public Builder siteElevation(Double v) { this.siteElevation = v; return this; }
        public Builder zenithDistance(Double v) { this.zenithDistance = v; return this; }
        public Builder airmass(Double v) { this.airmass = v; return this; }
        public Builder filter(String v) { this.filter = v; return this; }
        public Builder exposureTime(Double v) { this.exposureTime = v; return this; }
        public Builder observationTime(Instant v) { this.observationTime = v; return this; }

        public ObservationContext build() { return new ObservationContext(this); }
    }
}
