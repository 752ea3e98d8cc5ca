package com.orbitalsky.model;

import ij.process.ByteProcessor;

/**
 * Binary contamination mask, indexed {@code pixels[y][x]}: 0 = clean, anything else = contaminated.
 * The public constructor copies its input, so a mask never shares rows with the array it was built from.
 */
public class Mask {
    public final byte[][] pixels;
    public final DetectionMetadata meta;

    /** Copies {@code pixels}; later changes to the caller's array do not reach the mask. */
    public Mask(byte[][] pixels, DetectionMetadata meta) {
        this(meta, copy(pixels));
    }

    // ya es una copia propia
    private Mask(DetectionMetadata meta, byte[][] owned) {
        this.pixels = owned;
        this.meta = meta;
    }

    private static byte[][] copy(byte[][] pixels) {
        byte[][] out = new byte[pixels.length][];
        for (int y = 0; y < pixels.length; y++) out[y] = pixels[y].clone();
        return out;
    }

    public static Mask empty(int width, int height, DetectionMetadata meta) {
        return new Mask(meta, new byte[height][width]);
    }

    /** Copies a 0/non-zero ImageJ mask into a 0/1 array. */
    public static Mask fromProcessor(ByteProcessor bp, DetectionMetadata meta) {
        int w = bp.getWidth(), h = bp.getHeight();
        byte[] px = (byte[]) bp.getPixels();
        byte[][] out = new byte[h][w];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (px[y * w + x] != 0) out[y][x] = 1;
            }
        }
        return new Mask(meta, out);
    }

    public int width() { return pixels.length == 0 ? 0 : pixels[0].length; }
    public int height() { return pixels.length; }

    public boolean isContaminated(int x, int y) { return pixels[y][x] != 0; }

    public long contaminatedCount() {
        long n = 0;
        for (byte[] row : pixels) {
            for (byte b : row) if (b != 0) n++;
        }
        return n;
    }
}
