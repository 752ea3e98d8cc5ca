package com.orbitalsky.detection;

import ij.ImagePlus;
import ij.measure.Measurements;
import ij.measure.ResultsTable;
import ij.plugin.filter.ParticleAnalyzer;
import ij.process.ByteProcessor;
import ij.process.ImageProcessor;

import java.util.function.IntPredicate;

/**
 * Connected regions of a binary mask as measured by ImageJ's ParticleAnalyzer (8-connected).
 * <p>
 * Each row of the results table is one region with its pixel area and the axes of the ellipse with the same
 * second moments. The analyzer's count-mask image labels every region pixel with its row number + 1, which
 * is how regions are turned back into pixels.
 */
public final class ParticleRegions {

    private static final int MEASUREMENTS = Measurements.AREA | Measurements.ELLIPSE | Measurements.CENTROID;

    private final ResultsTable rt;
    private final int[] labels; // 0 = fondo
    private final boolean[] foreground;

    private ParticleRegions(ResultsTable rt, int[] labels, boolean[] foreground) {
        this.rt = rt;
        this.labels = labels;
        this.foreground = foreground;
    }

    /**
     * @param minSize regions with fewer pixels are dropped
     */
    public static ParticleRegions analyze(boolean[] fg, int width, int height, int minSize) {
        ByteProcessor bp = new ByteProcessor(width, height);
        byte[] px = (byte[]) bp.getPixels();
        boolean any = false;
        for (int i = 0; i < fg.length; i++) {
            if (fg[i]) {
                px[i] = (byte) 255;
                any = true;
            }
        }
        ResultsTable rt = new ResultsTable();
        int[] labels = new int[width * height];
        if (!any) return new ParticleRegions(rt, labels, fg);

        bp.setThreshold(255, 255, ImageProcessor.NO_LUT_UPDATE);
        ParticleAnalyzer pa = new ParticleAnalyzer(ParticleAnalyzer.SHOW_ROI_MASKS, MEASUREMENTS, rt,
                Math.max(0, minSize), Double.POSITIVE_INFINITY);
        pa.setHideOutputImage(true);
        pa.analyze(new ImagePlus("", bp));

        if (rt.getCounter() > 0) {
            ImagePlus countMask = pa.getOutputImage();
            if (countMask == null) throw new IllegalStateException("ParticleAnalyzer returned no count mask");
            ImageProcessor lp = countMask.getProcessor();
            for (int i = 0; i < labels.length; i++) labels[i] = lp.get(i);
        }
        return new ParticleRegions(rt, labels, fg);
    }

    public int count() {
        return rt.getCounter();
    }

    public double area(int region) {
        return rt.getValue("Area", region);
    }

    public double majorAxis(int region) {
        return rt.getValue("Major", region);
    }

    public double minorAxis(int region) {
        return rt.getValue("Minor", region);
    }

    public double centroidX(int region) {
        return rt.getValue("X", region);
    }

    public double centroidY(int region) {
        return rt.getValue("Y", region);
    }

    /** Major over minor axis; infinite when the minor axis is 0. */
    public double aspectRatio(int region) {
        double minor = minorAxis(region);
        return minor > 0 ? majorAxis(region) / minor : Double.POSITIVE_INFINITY;
    }

    /** Union of the pixels of the regions accepted by {@code keep}. */
    public boolean[] pixels(IntPredicate keep) {
        int n = count();
        boolean[] accepted = new boolean[n];
        for (int r = 0; r < n; r++) accepted[r] = keep.test(r);

        boolean[] out = new boolean[labels.length];
        for (int i = 0; i < labels.length; i++) {
            int label = labels[i];
            // la máscara de la ROI incluye huecos interiores; solo cuentan los píxeles encendidos
            if (label > 0 && label <= n && accepted[label - 1] && foreground[i]) out[i] = true;
        }
        return out;
    }

    /** Pixels of all regions that passed the size filter. */
    public boolean[] pixels() {
        return pixels(r -> true);
    }
}
