package com.orbitalsky.detection;

import ij.process.FloatProcessor;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Canny edge detector over a FloatProcessor: Gaussian smoothing, Sobel gradient, non-maximum suppression
 * along the quantized gradient direction and hysteresis between two magnitude thresholds.
 * <p>
 * Thresholds apply to the unnormalized Sobel magnitude. The outermost pixel ring never holds an edge.
 */
public class CannyEdgeDetector {

    private final double sigma;
    private final double lowThreshold;
    private final double highThreshold;

    public CannyEdgeDetector(double sigma, double lowThreshold, double highThreshold) {
        if (sigma < 0) throw new IllegalArgumentException("sigma must be non-negative");
        if (lowThreshold > highThreshold) {
            throw new IllegalArgumentException("lowThreshold must not exceed highThreshold");
        }
        this.sigma = sigma;
        this.lowThreshold = lowThreshold;
        this.highThreshold = highThreshold;
    }

    public boolean[] detect(FloatProcessor input) {
        int w = input.getWidth(), h = input.getHeight();
        boolean[] edges = new boolean[w * h];
        if (w < 3 || h < 3) return edges;

        float[] px = (float[]) ImageOps.gaussian(input, sigma).getPixels();

        // --- GRADIENTE (Sobel) ---
        float[] gx = new float[w * h];
        float[] gy = new float[w * h];
        float[] mag = new float[w * h];
        for (int y = 1; y < h - 1; y++) {
            for (int x = 1; x < w - 1; x++) {
                int i = y * w + x;
                float tl = px[i - w - 1], t = px[i - w], tr = px[i - w + 1];
                float l = px[i - 1], r = px[i + 1];
                float bl = px[i + w - 1], b = px[i + w], br = px[i + w + 1];
                gx[i] = (tr + 2 * r + br) - (tl + 2 * l + bl);
                gy[i] = (bl + 2 * b + br) - (tl + 2 * t + tr);
                mag[i] = (float) Math.hypot(gx[i], gy[i]);
            }
        }

        // --- SUPRESIÓN DE NO-MÁXIMOS ---
        byte[] state = new byte[w * h]; // 0 nada, 1 débil, 2 fuerte
        for (int y = 1; y < h - 1; y++) {
            for (int x = 1; x < w - 1; x++) {
                int i = y * w + x;
                float m = mag[i];
                if (m < lowThreshold || m == 0) continue;
                int step = neighbourStep(gx[i], gy[i], w);
                if (m < mag[i + step] || m < mag[i - step]) continue;
                state[i] = (byte) (m >= highThreshold ? 2 : 1);
            }
        }

        // --- HISTÉRESIS ---
        Deque<Integer> stack = new ArrayDeque<>();
        for (int i = 0; i < state.length; i++) {
            if (state[i] == 2) {
                edges[i] = true;
                stack.push(i);
            }
        }
        while (!stack.isEmpty()) {
            int i = stack.pop();
            int x = i % w, y = i / w;
            for (int dy = -1; dy <= 1; dy++) {
                for (int dx = -1; dx <= 1; dx++) {
                    int nx = x + dx, ny = y + dy;
                    if (nx < 1 || ny < 1 || nx >= w - 1 || ny >= h - 1) continue;
                    int n = ny * w + nx;
                    if (!edges[n] && state[n] == 1) {
                        edges[n] = true;
                        stack.push(n);
                    }
                }
            }
        }
        return edges;
    }

    /** Offset to the neighbour along the gradient, quantized to 0/45/90/135 degrees. */
    private static int neighbourStep(float gx, float gy, int w) {
        double angle = Math.toDegrees(Math.atan2(gy, gx));
        if (angle < 0) angle += 180;
        if (angle < 22.5 || angle >= 157.5) return 1;
        if (angle < 67.5) return w + 1;
        if (angle < 112.5) return w;
        return w - 1;
    }
}
