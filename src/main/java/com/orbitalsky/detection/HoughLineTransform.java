package com.orbitalsky.detection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Straight-line Hough transform over a binary edge map with greedy peak extraction.
 * <p>
 * Angles are sampled at 1 degree over [-90, 90) and distances at 1 pixel over [-diagonal, diagonal].
 * Only cells that hold the maximum of their {@code minDistance} x {@code minAngle} neighbourhood are
 * peak candidates, so the wings of a strong peak never count as lines of their own.
 * Candidates are taken in decreasing vote order; each accepted peak suppresses every cell within
 * {@code minAngle} bins and {@code minDistance} pixels, wrapping across the +/-90 degree seam where
 * the same line reappears with its distance negated. The reported distance of a peak is the
 * vote-weighted mean of the above-threshold cells in its suppression window, which centres the line
 * between the two edges of a wide streak.
 */
public class HoughLineTransform {

    public static final int ANGLE_BINS = 180;
    public static final int DEFAULT_MIN_DISTANCE = 9;
    public static final int DEFAULT_MIN_ANGLE = 10;

    private final int minDistance;
    private final int minAngle;

    public HoughLineTransform() {
        this(DEFAULT_MIN_DISTANCE, DEFAULT_MIN_ANGLE);
    }

    public HoughLineTransform(int minDistance, int minAngle) {
        this.minDistance = minDistance;
        this.minAngle = minAngle;
    }

    /** Vote accumulator, indexed {@code votes[distanceBin][angleBin]}. */
    public static class Accumulator {
        public final int[][] votes;
        public final double[] angles;
        public final int offset; // bin de distancia 0 corresponde a -offset

        Accumulator(int[][] votes, double[] angles, int offset) {
            this.votes = votes;
            this.angles = angles;
            this.offset = offset;
        }

        public int max() {
            int m = 0;
            for (int[] row : votes) for (int v : row) m = Math.max(m, v);
            return m;
        }
    }

    public Accumulator accumulate(boolean[] edges, int width, int height) {
        int offset = (int) Math.ceil(Math.hypot(width, height));
        int[][] votes = new int[2 * offset + 1][ANGLE_BINS];
        double[] angles = new double[ANGLE_BINS];
        double[] cos = new double[ANGLE_BINS];
        double[] sin = new double[ANGLE_BINS];
        for (int t = 0; t < ANGLE_BINS; t++) {
            angles[t] = -Math.PI / 2 + t * Math.PI / ANGLE_BINS;
            cos[t] = Math.cos(angles[t]);
            sin[t] = Math.sin(angles[t]);
        }
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (!edges[y * width + x]) continue;
                for (int t = 0; t < ANGLE_BINS; t++) {
                    int d = (int) Math.round(x * cos[t] + y * sin[t]) + offset;
                    votes[d][t]++;
                }
            }
        }
        return new Accumulator(votes, angles, offset);
    }

    /**
     * @param threshold minimum votes for a peak
     * @param maxPeaks  cap on returned peaks, or {@code Integer.MAX_VALUE}
     */
    public List<HoughLine> peaks(Accumulator acc, double threshold, int maxPeaks) {
        int nd = acc.votes.length;
        int[][] localMax = neighbourhoodMax(acc);
        List<int[]> cells = new ArrayList<>();
        for (int d = 0; d < nd; d++) {
            for (int t = 0; t < ANGLE_BINS; t++) {
                int v = acc.votes[d][t];
                if (v > 0 && v >= threshold && v >= localMax[d][t]) cells.add(new int[]{v, d, t});
            }
        }
        // más votos primero; empate por orden de barrido
        cells.sort((a, b) -> a[0] != b[0] ? Integer.compare(b[0], a[0])
                : a[1] != b[1] ? Integer.compare(a[1], b[1]) : Integer.compare(a[2], b[2]));

        boolean[][] suppressed = new boolean[nd][ANGLE_BINS];
        List<HoughLine> lines = new ArrayList<>();
        for (int[] c : cells) {
            if (lines.size() >= maxPeaks) break;
            int d = c[1], t = c[2];
            if (suppressed[d][t]) continue;
            double distance = refinedDistance(acc, d, t, threshold);
            lines.add(new HoughLine(acc.angles[t], distance, c[0]));
            suppress(suppressed, d, t, acc.offset);
        }
        return lines;
    }

    /**
     * Maximum over the {@code (2 minDistance + 1) x (2 minAngle + 1)} window around each cell, computed as two
     * separable passes. Angle bins past the +/-90 degree seam read the mirrored distance bin.
     */
    int[][] neighbourhoodMax(Accumulator acc) {
        int nd = acc.votes.length;
        int[][] alongDistance = new int[nd][ANGLE_BINS];
        for (int t = 0; t < ANGLE_BINS; t++) {
            for (int d = 0; d < nd; d++) {
                int m = 0;
                int lo = Math.max(0, d - minDistance), hi = Math.min(nd - 1, d + minDistance);
                for (int k = lo; k <= hi; k++) m = Math.max(m, acc.votes[k][t]);
                alongDistance[d][t] = m;
            }
        }
        int[][] out = new int[nd][ANGLE_BINS];
        for (int d = 0; d < nd; d++) {
            for (int t = 0; t < ANGLE_BINS; t++) {
                int m = 0;
                for (int dt = -minAngle; dt <= minAngle; dt++) {
                    int tt = t + dt;
                    int dd = d;
                    if (tt < 0 || tt >= ANGLE_BINS) {
                        tt = Math.floorMod(tt, ANGLE_BINS);
                        dd = 2 * acc.offset - d;
                    }
                    if (dd >= 0 && dd < nd) m = Math.max(m, alongDistance[dd][tt]);
                }
                out[d][t] = m;
            }
        }
        return out;
    }

    private double refinedDistance(Accumulator acc, int d, int t, double threshold) {
        double sum = 0, weight = 0;
        int lo = Math.max(0, d - minDistance), hi = Math.min(acc.votes.length - 1, d + minDistance);
        for (int k = lo; k <= hi; k++) {
            int v = acc.votes[k][t];
            if (v >= threshold) {
                sum += (double) v * (k - acc.offset);
                weight += v;
            }
        }
        return weight > 0 ? sum / weight : d - acc.offset;
    }

    private void suppress(boolean[][] suppressed, int d, int t, int offset) {
        int nd = suppressed.length;
        for (int dt = -minAngle; dt <= minAngle; dt++) {
            int tt = t + dt;
            int centre = d;
            if (tt < 0 || tt >= ANGLE_BINS) {
                // cruzar la costura de +/-90 grados invierte el signo de la distancia
                tt = Math.floorMod(tt, ANGLE_BINS);
                centre = 2 * offset - d;
            }
            for (int dd = -minDistance; dd <= minDistance; dd++) {
                int k = centre + dd;
                if (k >= 0 && k < nd) suppressed[k][tt] = true;
            }
        }
    }

    /** Flags every pixel closer than {@code halfWidth} to any of the lines. */
    public static boolean[] rasterize(List<HoughLine> lines, int width, int height, double halfWidth) {
        boolean[] out = new boolean[width * height];
        for (HoughLine line : lines) {
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    if (line.distanceTo(x, y) < halfWidth) out[y * width + x] = true;
                }
            }
        }
        return out;
    }

    static boolean any(boolean[] values) {
        for (boolean v : values) if (v) return true;
        return false;
    }

    static int count(boolean[] values) {
        int n = 0;
        for (boolean v : values) if (v) n++;
        return n;
    }

    static boolean[] and(boolean[] a, boolean[] b) {
        boolean[] out = Arrays.copyOf(a, a.length);
        for (int i = 0; i < out.length; i++) out[i] &= b[i];
        return out;
    }
}
