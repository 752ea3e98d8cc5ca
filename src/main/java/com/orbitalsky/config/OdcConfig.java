package com.orbitalsky.config;

public class OdcConfig {
    private int bootstrapSamples = 100;
    private long seed = 42L;
    private double extinction = 0.25;
    private boolean usePhysicalModel = true;

    /**
     * @return number of bootstrap resamples for the confidence interval; 0 disables it
     */
    public int getBootstrapSamples() {
        return bootstrapSamples;
    }

    public void setBootstrapSamples(int bootstrapSamples) {
        this.bootstrapSamples = bootstrapSamples;
    }

    public long getSeed() {
        return seed;
    }

    public void setSeed(long seed) {
        this.seed = seed;
    }

    /**
     * @return atmospheric extinction coefficient in mag/airmass
     */
    public double getExtinction() {
        return extinction;
    }

    public void setExtinction(double extinction) {
        this.extinction = extinction;
    }

    public boolean isUsePhysicalModel() {
        return usePhysicalModel;
    }

    public void setUsePhysicalModel(boolean usePhysicalModel) {
        this.usePhysicalModel = usePhysicalModel;
    }
}
