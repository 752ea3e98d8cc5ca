package com.orbitalsky.skyglow;

import com.orbitalsky.config.CalibrationConfig;
import com.orbitalsky.model.ObservationContext;
import com.orbitalsky.model.OdcResidual;
import com.orbitalsky.model.SkyBrightness;
import com.orbitalsky.model.SkyGeometry;

import java.time.Instant;

/**
 * Natural sky brightness (mag/arcsec²) as the flux sum of moonlight (Krisciunas &amp; Schaefer 1991),
 * Rayleigh scattering / airglow and twilight.
 * <p>
 * The dark-sky level and the lunar calibration offset come from {@link CalibrationConfig}; they are working
 * values, not a photometric calibration.
 */
public class NaturalSkyModel {

    public static final String MODEL_VERSION = "v1.0_krisciunas_schaefer";
    public static final double DEFAULT_ALTITUDE_M = 2400.0;
    public static final double DEFAULT_EXTINCTION = 0.25;

    private static final double MOON_SET_ALTITUDE = -10.0;
    private static final double AIRMASS_CAP_ZENITH_DISTANCE = 70.0;
    private static final double AIRMASS_CAP = 5.0;
    private static final double SCALE_HEIGHT_M = 8000.0;

    private final SkyEphemeris ephemeris;
    private final CalibrationConfig calibration;

    public NaturalSkyModel() {
        this(new LowPrecisionEphemeris(), new CalibrationConfig());
    }

    public NaturalSkyModel(SkyEphemeris ephemeris, CalibrationConfig calibration) {
        this.ephemeris = ephemeris;
        this.calibration = calibration;
    }

    /**
     * Evaluates the model at the context's time and site, substituting the context defaults for missing fields.
     *
     * @throws IllegalStateException if the context has no observation time
     */
    public SkyBrightness naturalSkyBrightness(ObservationContext ctx, double extinction) {
        if (ctx.observationTime == null) {
            throw new IllegalStateException("Observation time is required for the sky model");
        }
        return naturalSkyBrightness(ctx.observationTime, ctx.latitudeOrDefault(), ctx.longitudeOrDefault(),
                ctx.zenithDistanceOrDefault(), ctx.elevationOrDefault(), extinction);
    }

    public SkyBrightness naturalSkyBrightness(Instant time, double latitude, double longitude,
                                              double zenithDistance, double altitudeM, double extinction) {
        SkyGeometry geo = ephemeris.geometry(time, latitude, longitude);

        double lunar = lunarBrightness(geo.moonAltitude, geo.moonPhaseAngle, zenithDistance, extinction);
        double rayleigh = rayleighBrightness(zenithDistance, altitudeM);
        double twilight = twilightBrightness(geo.sunAltitude);
        double total = combine(lunar, rayleigh, twilight);

        return new SkyBrightness(total, lunar, rayleigh, twilight, geo, zenithDistance, MODEL_VERSION);
    }

    public double lunarBrightness(double moonAltitude, double moonPhaseAngle, double zenithDistance, double extinction) {
        double dark = calibration.getDarkSkyMagnitude();
        if (moonAltitude < MOON_SET_ALTITUDE) return dark;

        double rho = Math.toRadians(zenithDistance);
        double alpha = Math.toRadians(moonPhaseAngle);
        double hMoon = Math.toRadians(moonAltitude);

        double illuminance = Math.pow(10, -0.4 * (3.84 + 0.026 * Math.abs(alpha) + 4e-9 * Math.pow(alpha, 4)));
        double moonAirmass = 1.0 / (Math.sin(hMoon) + 0.025 * Math.exp(-11 * Math.sin(hMoon)));
        double scattering = Math.pow(10, 5.36) * (1.06 + Math.cos(rho) * Math.cos(rho));

        double flux = scattering * illuminance
                * Math.pow(10, -0.4 * extinction * moonAirmass)
                * (1 - Math.pow(10, -0.4 * extinction / Math.cos(rho)));

        if (!(flux > 0) || Double.isInfinite(flux)) return dark;
        return -2.5 * Math.log10(flux) + calibration.getLunarCalibrationOffset();
    }

    public double rayleighBrightness(double zenithDistance, double altitudeM) {
        double pressureRatio = Math.exp(-altitudeM / SCALE_HEIGHT_M);
        return calibration.getDarkSkyMagnitude() - 2.5 * Math.log10(airmass(zenithDistance) * pressureRatio);
    }

    public double twilightBrightness(double sunAltitude) {
        if (sunAltitude > -6) return 10.0;   // civil o de día
        if (sunAltitude > -12) return 16.0;  // náutico
        if (sunAltitude > -18) return 19.0;  // astronómico
        return calibration.getDarkSkyMagnitude();
    }

    /** Plane-parallel airmass, held at 5 beyond 70 degrees from the zenith. */
    public static double airmass(double zenithDistance) {
        if (zenithDistance >= AIRMASS_CAP_ZENITH_DISTANCE) return AIRMASS_CAP;
        return 1.0 / Math.cos(Math.toRadians(zenithDistance));
    }

    /** Adds sources in flux and converts the total back to a magnitude. */
    public static double combine(double... magnitudes) {
        double flux = 0;
        for (double m : magnitudes) flux += Math.pow(10, -0.4 * m);
        return -2.5 * Math.log10(flux);
    }

    public OdcResidual estimateOdcFromObserved(double observedMagnitude, SkyBrightness natural) {
        double odcMag = natural.totalSkyBrightness - observedMagnitude;
        double fluxRatio = Math.pow(10, 0.4 * odcMag);
        double percent = (fluxRatio - 1.0) * 100.0;
        return new OdcResidual(odcMag, percent, observedMagnitude, natural.totalSkyBrightness,
                percent > calibration.getSignificantExcessPercent(), natural);
    }
}
