package com.orbitalsky.skyglow;

import com.orbitalsky.model.SkyGeometry;

import java.time.Instant;

/**
 * Analytic Sun and Moon positions good to a few tenths of a degree between 1950 and 2050: the Astronomical
 * Almanac low-precision solar formulae and the six largest lunar longitude terms, with the lunar altitude
 * corrected for horizontal parallax. The phase angle is the illuminated fraction scaled to [0, 180].
 */
public class LowPrecisionEphemeris implements SkyEphemeris {

    private static final double J2000 = 2451545.0;
    private static final double UNIX_EPOCH_JD = 2440587.5;

    @Override
    public SkyGeometry geometry(Instant time, double latitude, double longitude) {
        double jd = UNIX_EPOCH_JD + (time.getEpochSecond() + time.getNano() / 1e9) / 86400.0;
        double d = jd - J2000;
        double t = d / 36525.0;
        double eps = 23.439 - 0.0000004 * d;

        // --- SOL ---
        double g = 357.528 + 0.9856003 * d;
        double lambdaSun = 280.460 + 0.9856474 * d + 1.915 * sin(g) + 0.020 * sin(2 * g);
        double[] sunEq = toEquatorial(lambdaSun, 0.0, eps);

        // --- LUNA ---
        double lambdaMoon = 218.32 + 481267.881 * t
                + 6.29 * sin(135.0 + 477198.87 * t)
                - 1.27 * sin(259.3 - 413335.36 * t)
                + 0.66 * sin(235.7 + 890534.22 * t)
                + 0.21 * sin(269.9 + 954397.74 * t)
                - 0.19 * sin(357.5 + 35999.05 * t)
                - 0.11 * sin(186.5 + 966404.03 * t);
        double betaMoon = 5.13 * sin(93.3 + 483202.02 * t)
                + 0.28 * sin(228.2 + 960400.89 * t)
                - 0.28 * sin(318.3 + 6003.15 * t)
                - 0.17 * sin(217.6 - 407332.21 * t);
        double parallax = 0.9508
                + 0.0518 * cos(135.0 + 477198.87 * t)
                + 0.0095 * cos(259.3 - 413335.38 * t)
                + 0.0078 * cos(235.7 + 890534.23 * t)
                + 0.0028 * cos(269.9 + 954397.70 * t);
        double[] moonEq = toEquatorial(lambdaMoon, betaMoon, eps);

        double lst = 280.46061837 + 360.98564736629 * d + longitude;
        double sunAlt = altitude(sunEq, lst, latitude);
        double moonAlt = altitude(moonEq, lst, latitude);
        moonAlt -= parallax * cos(moonAlt);

        double cosElongation = cos(betaMoon) * cos(lambdaMoon - lambdaSun);
        double illuminated = (1 - cosElongation) / 2;

        return new SkyGeometry(moonAlt, illuminated * 180.0, sunAlt);
    }

    /** @return {right ascension, declination} in degrees */
    private static double[] toEquatorial(double lambda, double beta, double eps) {
        double sinDec = sin(beta) * cos(eps) + cos(beta) * sin(eps) * sin(lambda);
        double ra = Math.toDegrees(Math.atan2(sin(lambda) * cos(eps) - Math.tan(Math.toRadians(beta)) * sin(eps), cos(lambda)));
        return new double[]{ra, Math.toDegrees(Math.asin(sinDec))};
    }

    private static double altitude(double[] eq, double lst, double latitude) {
        double hourAngle = lst - eq[0];
        double sinAlt = sin(latitude) * sin(eq[1]) + cos(latitude) * cos(eq[1]) * cos(hourAngle);
        return Math.toDegrees(Math.asin(Math.max(-1, Math.min(1, sinAlt))));
    }

    private static double sin(double deg) { return Math.sin(Math.toRadians(deg)); }
    private static double cos(double deg) { return Math.cos(Math.toRadians(deg)); }
}
