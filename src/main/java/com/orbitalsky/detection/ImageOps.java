package com.orbitalsky.detection;

import com.orbitalsky.utils.Stats;
import ij.plugin.filter.GaussianBlur;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;

/**
 * Conversions between {@code double[y][x]} arrays and ImageJ processors, plus the filters shared by the detectors.
 */
public final class ImageOps {

    private static final double BLUR_ACCURACY = 0.002;

    private ImageOps() {
    }

    /**
     * @throws IllegalArgumentException if the array is empty or rows differ in length
     */
    public static void requireImage(double[][] image) {
        if (image == null || image.length == 0 || image[0] == null || image[0].length == 0) {
            throw new IllegalArgumentException("Image must be a non-empty 2-D array");
        }
        int w = image[0].length;
        for (int y = 1; y < image.length; y++) {
            if (image[y] == null || image[y].length != w) {
                throw new IllegalArgumentException("Image rows must all have length " + w + " (row " + y + " differs)");
            }
        }
    }

    /**
     * Copies the image into a new FloatProcessor. NaN and infinite pixels are replaced by the median of the
     * finite ones (0 when there are none).
     */
    public static FloatProcessor toSanitizedProcessor(double[][] image) {
        requireImage(image);
        int h = image.length, w = image[0].length;
        FloatProcessor ip = new FloatProcessor(w, h);
        float[] px = (float[]) ip.getPixels();

        int finite = 0;
        for (double[] row : image) {
            for (double v : row) if (Double.isFinite(v)) finite++;
        }
        double fill = 0.0;
        if (finite > 0 && finite < (long) w * h) {
            double[] values = new double[finite];
            int i = 0;
            for (double[] row : image) {
                for (double v : row) if (Double.isFinite(v)) values[i++] = v;
            }
            fill = Stats.median(values);
        }

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double v = image[y][x];
                px[y * w + x] = (float) (Double.isFinite(v) ? v : fill);
            }
        }
        return ip;
    }

    /** Returns a blurred copy; the input is left untouched. */
    public static FloatProcessor gaussian(FloatProcessor ip, double sigma) {
        FloatProcessor out = (FloatProcessor) ip.duplicate();
        if (sigma > 0) {
            new GaussianBlur().blurGaussian(out, sigma, sigma, BLUR_ACCURACY);
        }
        return out;
    }

    public static double percentile(FloatProcessor ip, double p) {
        float[] px = (float[]) ip.getPixels();
        double[] values = new double[px.length];
        for (int i = 0; i < px.length; i++) values[i] = px[i];
        return Stats.percentile(values, p);
    }

    /** Pixels strictly above {@code threshold}. */
    public static boolean[] above(FloatProcessor ip, double threshold) {
        float[] px = (float[]) ip.getPixels();
        boolean[] out = new boolean[px.length];
        for (int i = 0; i < px.length; i++) out[i] = px[i] > threshold;
        return out;
    }

    /** Pixels strictly above the matching pixel of {@code threshold}. */
    public static boolean[] above(FloatProcessor ip, FloatProcessor threshold) {
        float[] px = (float[]) ip.getPixels();
        float[] th = (float[]) threshold.getPixels();
        boolean[] out = new boolean[px.length];
        for (int i = 0; i < px.length; i++) out[i] = px[i] > th[i];
        return out;
    }

    public static ByteProcessor toByteProcessor(boolean[] fg, int width, int height) {
        ByteProcessor bp = new ByteProcessor(width, height);
        byte[] px = (byte[]) bp.getPixels();
        for (int i = 0; i < fg.length; i++) if (fg[i]) px[i] = 1;
        return bp;
    }
}
