package com.orbitalsky.detection;

/** Synthetic frames for detector tests. */
public final class TestImages {

    private TestImages() {
    }

    public static double[][] flat(int width, int height, double value) {
        double[][] img = new double[height][width];
        for (double[] row : img) java.util.Arrays.fill(row, value);
        return img;
    }

    /** Horizontal band of {@code value} over rows [y0, y0 + thickness) and columns [x0, x1). */
    public static double[][] withHorizontalStreak(double[][] img, int y0, int thickness, int x0, int x1, double value) {
        for (int y = y0; y < y0 + thickness; y++) {
            for (int x = x0; x < x1; x++) img[y][x] = value;
        }
        return img;
    }

    /** Diagonal band, {@code halfWidth} pixels either side of y = x + offset. */
    public static double[][] withDiagonalStreak(double[][] img, int offset, double halfWidth, double value) {
        for (int y = 0; y < img.length; y++) {
            for (int x = 0; x < img[y].length; x++) {
                if (Math.abs(y - x - offset) / Math.sqrt(2) <= halfWidth) img[y][x] = value;
            }
        }
        return img;
    }

    /** Band of {@code value} over the pixels within {@code halfWidth} of the segment (x0, y0)-(x1, y1). */
    public static double[][] withSegment(double[][] img, double x0, double y0, double x1, double y1,
                                         double halfWidth, double value) {
        double dx = x1 - x0, dy = y1 - y0;
        double len2 = dx * dx + dy * dy;
        for (int y = 0; y < img.length; y++) {
            for (int x = 0; x < img[y].length; x++) {
                double t = Math.max(0, Math.min(1, ((x - x0) * dx + (y - y0) * dy) / len2));
                if (Math.hypot(x - (x0 + t * dx), y - (y0 + t * dy)) <= halfWidth) img[y][x] = value;
            }
        }
        return img;
    }
}
