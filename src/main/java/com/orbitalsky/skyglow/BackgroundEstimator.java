package com.orbitalsky.skyglow;

import com.orbitalsky.detection.ImageOps;
import com.orbitalsky.model.Mask;
import com.orbitalsky.utils.Stats;

/**
 * Sky background of one frame as the median of its unmasked pixels.
 */
public final class BackgroundEstimator {

    private BackgroundEstimator() {
    }

    /**
     * @param mask may be null, in which case every pixel counts
     * @return the median of the finite pixels where the mask is 0, or {@code Double.NaN} when there are none
     * @throws IllegalArgumentException if the mask does not match the image shape
     */
    public static double estimate(double[][] image, Mask mask) {
        ImageOps.requireImage(image);
        int h = image.length, w = image[0].length;
        if (mask != null && (mask.height() != h || mask.width() != w)) {
            throw new IllegalArgumentException(String.format("Mask %dx%d does not match image %dx%d",
                    mask.width(), mask.height(), w, h));
        }

        double[] values = new double[w * h];
        int n = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (mask != null && mask.pixels[y][x] != 0) continue;
                double v = image[y][x];
                if (Double.isFinite(v)) values[n++] = v;
            }
        }
        if (n == 0) return Double.NaN;
        double[] valid = new double[n];
        System.arraycopy(values, 0, valid, 0, n);
        return Stats.median(valid);
    }

    public static boolean isDefined(double background) {
        return !Double.isNaN(background);
    }
}
