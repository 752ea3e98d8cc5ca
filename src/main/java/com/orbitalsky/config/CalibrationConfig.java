package com.orbitalsky.config;

/**
 * Magnitude constants used by the sky model and the background-to-magnitude conversion.
 * <p>
 * These are provisional values, not a photometric calibration.
 */
public class CalibrationConfig {
    private double darkSkyMagnitude = 22.0;
    private double lunarCalibrationOffset = 21.58;
    private double brightMagnitude = 18.0;
    private double faintMagnitude = 22.0;
    private double significantExcessPercent = 5.0;

    public double getDarkSkyMagnitude() {
        return darkSkyMagnitude;
    }

    public void setDarkSkyMagnitude(double darkSkyMagnitude) {
        this.darkSkyMagnitude = darkSkyMagnitude;
    }

    public double getLunarCalibrationOffset() {
        return lunarCalibrationOffset;
    }

    public void setLunarCalibrationOffset(double lunarCalibrationOffset) {
        this.lunarCalibrationOffset = lunarCalibrationOffset;
    }

    /**
     * @return magnitude assigned to the 95th-percentile (brightest) background
     */
    public double getBrightMagnitude() {
        return brightMagnitude;
    }

    public void setBrightMagnitude(double brightMagnitude) {
        this.brightMagnitude = brightMagnitude;
    }

    /**
     * @return magnitude assigned to the 5th-percentile (darkest) background
     */
    public double getFaintMagnitude() {
        return faintMagnitude;
    }

    public void setFaintMagnitude(double faintMagnitude) {
        this.faintMagnitude = faintMagnitude;
    }

    public double getSignificantExcessPercent() {
        return significantExcessPercent;
    }

    public void setSignificantExcessPercent(double significantExcessPercent) {
        this.significantExcessPercent = significantExcessPercent;
    }
}
