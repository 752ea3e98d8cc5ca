package com.orbitalsky.skyglow;

import com.orbitalsky.config.CalibrationConfig;
import com.orbitalsky.config.OdcConfig;
import com.orbitalsky.model.Frame;
import com.orbitalsky.model.Mask;
import com.orbitalsky.model.ObservationContext;
import com.orbitalsky.model.OdcMethod;
import com.orbitalsky.model.OdcResidual;
import com.orbitalsky.model.OdcResult;
import com.orbitalsky.model.SkyBrightness;
import com.orbitalsky.utils.Stats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;
import java.util.stream.IntStream;

/**
 * Orbital Diffuse Contribution of a batch of frames.
 * <p>
 * The percentile method always runs: the 5th percentile of the masked frame backgrounds stands for natural
 * sky and the median for the observed level. When a frame header carries observing conditions, the
 * median background is also mapped onto a magnitude scale and compared with {@link NaturalSkyModel}; the
 * residual goes into {@link OdcResult#physicalModel} while the headline percent stays the percentile one.
 * If that comparison fails the method tag says so.
 */
public class OdcEstimator {
    private static final Logger logger = LoggerFactory.getLogger(OdcEstimator.class);

    private final OdcConfig config;
    private final CalibrationConfig calibration;
    private final NaturalSkyModel skyModel;

    public OdcEstimator() {
        this(new OdcConfig(), new CalibrationConfig());
    }

    public OdcEstimator(OdcConfig config, CalibrationConfig calibration) {
        this(config, calibration, new NaturalSkyModel(new LowPrecisionEphemeris(), calibration));
    }

    public OdcEstimator(OdcConfig config, CalibrationConfig calibration, NaturalSkyModel skyModel) {
        if (config.getBootstrapSamples() < 0) throw new IllegalArgumentException("bootstrapSamples must be >= 0");
        this.config = config;
        this.calibration = calibration;
        this.skyModel = skyModel;
    }

    public OdcResult estimate(List<Frame> frames, List<Mask> masks) {
        return estimate(frames, masks, config.getSeed());
    }

    /**
     * @param seed seeds the bootstrap resampling; equal inputs and seed give equal intervals
     * @throws IllegalArgumentException if the frame and mask lists differ in length
     */
    public OdcResult estimate(List<Frame> frames, List<Mask> masks, long seed) {
        if (frames.size() != masks.size()) {
            throw new IllegalArgumentException("Got " + frames.size() + " frames but " + masks.size() + " masks");
        }

        // --- FONDOS ---
        List<Double> backgrounds = new ArrayList<>();
        List<Frame> usable = new ArrayList<>();
        int skipped = 0;
        for (int i = 0; i < frames.size(); i++) {
            Frame f = frames.get(i);
            double bg = BackgroundEstimator.estimate(f.data, masks.get(i));
            if (!BackgroundEstimator.isDefined(bg)) {
                logger.warn("No unmasked pixels in {}, excluded from ODC", f.fileName());
                skipped++;
                continue;
            }
            backgrounds.add(bg);
            usable.add(f);
        }
        if (backgrounds.isEmpty()) {
            logger.warn("No valid background data across {} frames", frames.size());
            return OdcResult.noValidData(skipped);
        }
        double[] bg = Stats.toArray(backgrounds);

        // --- MÉTODO PERCENTIL ---
        double baseline = Stats.percentile(bg, 5);
        double median = Stats.median(bg);
        double percentilePercent = excessPercent(baseline, median);
        double[] ci = bootstrapInterval(bg, config.getBootstrapSamples(), seed);

        // --- MODELO FÍSICO ---
        OdcMethod method = OdcMethod.PERCENTILE_BASELINE;
        OdcResidual residual = null;
        String fallbackReason = null;
        if (config.isUsePhysicalModel()) {
            ObservationContext ctx = firstContext(usable);
            if (ctx != null) {
                try {
                    SkyBrightness natural = skyModel.naturalSkyBrightness(ctx, config.getExtinction());
                    double observed = backgroundToMagnitude(median, baseline, Stats.percentile(bg, 95));
                    residual = skyModel.estimateOdcFromObserved(observed, natural);
                    method = OdcMethod.PHYSICAL_MODEL;
                } catch (RuntimeException e) {
                    logger.warn("Physical sky model unavailable, keeping percentile baseline: {}", e.getMessage());
                    method = OdcMethod.PERCENTILE_FALLBACK;
                    fallbackReason = e.getMessage();
                }
            }
        }

        double magDiff = magnitudeExcess(baseline, median);
        logger.info("ODC {} = {}% over {} frames (CI95 {} .. {})", method.tag(),
                String.format("%.2f", percentilePercent), bg.length,
                String.format("%.2f", ci[0]), String.format("%.2f", ci[1]));
        if (residual != null) {
            logger.info("Physical model residual: {}% ({} mag)", String.format("%.2f", residual.odcPercentFlux),
                    String.format("%.3f", residual.odcMagnitudeDiff));
        }

        return new OdcResult(OdcResult.Status.OK, null, method, percentilePercent, percentilePercent, magDiff, ci,
                baseline, median, bg.length, skipped, residual, fallbackReason);
    }

    /** {@code max(0, median - baseline) / baseline} in percent; 0 for a non-positive baseline. */
    public static double excessPercent(double baseline, double median) {
        if (baseline <= 0) return 0.0;
        return Math.max(0, median - baseline) / baseline * 100.0;
    }

    private static double magnitudeExcess(double baseline, double median) {
        if (baseline <= 0 || median <= baseline) return 0.0;
        return 2.5 * Math.log10(median / baseline);
    }

    /**
     * Percentile-baseline ODC recomputed on {@code samples} resamples with replacement; returns the
     * 2.5/97.5 percentile band, or {0, 0} when {@code samples} is 0. Each resample draws from its own
     * generator seeded from {@code seed}, so the band does not depend on evaluation order.
     */
    public static double[] bootstrapInterval(double[] backgrounds, int samples, long seed) {
        if (samples <= 0) return new double[]{0.0, 0.0};
        long[] seeds = new SplittableRandom(seed).longs(samples).toArray();
        int n = backgrounds.length;
        double[] odcs = IntStream.range(0, samples).parallel().mapToDouble(s -> {
            SplittableRandom rng = new SplittableRandom(seeds[s]);
            double[] sample = new double[n];
            for (int i = 0; i < n; i++) sample[i] = backgrounds[rng.nextInt(n)];
            return excessPercent(Stats.percentile(sample, 5), Stats.median(sample));
        }).toArray();
        return new double[]{Stats.percentile(odcs, 2.5), Stats.percentile(odcs, 97.5)};
    }

    /**
     * Maps a background level linearly from [p5, p95] onto [faint, bright] magnitudes, clamped at both ends.
     * A batch with no spread maps to the faint end.
     */
    public double backgroundToMagnitude(double level, double p5, double p95) {
        double faint = calibration.getFaintMagnitude();
        double bright = calibration.getBrightMagnitude();
        if (!(p95 > p5)) return faint;
        double frac = Math.max(0, Math.min(1, (level - p5) / (p95 - p5)));
        return faint - frac * (faint - bright);
    }

    /** First frame with an observation time; failing that, the first with any metadata. */
    private static ObservationContext firstContext(List<Frame> frames) {
        ObservationContext partial = null;
        for (Frame f : frames) {
            ObservationContext ctx = ObservationContextReader.fromHeader(f.header);
            if (ctx.observationTime != null) return ctx;
            if (partial == null && ctx.hasMetadata) partial = ctx;
        }
        return partial;
    }
}
