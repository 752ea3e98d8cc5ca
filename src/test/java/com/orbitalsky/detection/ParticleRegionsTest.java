package com.orbitalsky.detection;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ParticleRegionsTest {

    private static void fill(boolean[] fg, int w, int x0, int y0, int x1, int y1) {
        for (int y = y0; y < y1; y++) for (int x = x0; x < x1; x++) fg[y * w + x] = true;
    }

    @Test
    void measuresSeparateComponents() {
        int w = 30, h = 30;
        boolean[] fg = new boolean[w * h];
        fill(fg, w, 2, 2, 6, 6);
        fill(fg, w, 10, 20, 28, 22);

        ParticleRegions regions = ParticleRegions.analyze(fg, w, h, 1);

        assertEquals(2, regions.count());
        assertEquals(16 + 36, regions.area(0) + regions.area(1), 1e-9);
        assertEquals(52, HoughLineTransform.count(regions.pixels()));
    }

    @Test
    void diagonalNeighboursAreConnected() {
        int w = 5, h = 5;
        boolean[] fg = new boolean[w * h];
        for (int i = 0; i < 5; i++) fg[i * w + i] = true;

        assertEquals(1, ParticleRegions.analyze(fg, w, h, 1).count());
    }

    @Test
    void elongatedBarHasHighAspectRatio() {
        int w = 60, h = 20;
        boolean[] fg = new boolean[w * h];
        fill(fg, w, 5, 9, 55, 12);

        ParticleRegions regions = ParticleRegions.analyze(fg, w, h, 1);

        assertEquals(1, regions.count());
        assertEquals(150, regions.area(0), 1e-9);
        // centroide en el centro de los píxeles
        assertEquals(30.0, regions.centroidX(0), 1e-6);
        assertEquals(10.5, regions.centroidY(0), 1e-6);
        assertTrue(regions.majorAxis(0) > 50, "major " + regions.majorAxis(0));
        assertTrue(regions.aspectRatio(0) > 10);
    }

    @Test
    void minSizeDropsSpecks() {
        int w = 20, h = 20;
        boolean[] fg = new boolean[w * h];
        fg[0] = true;
        fill(fg, w, 5, 5, 10, 10);

        ParticleRegions regions = ParticleRegions.analyze(fg, w, h, 5);
        boolean[] kept = regions.pixels();

        assertEquals(1, regions.count());
        assertFalse(kept[0]);
        assertEquals(25, HoughLineTransform.count(kept));
    }

    @Test
    void selectsRegionsByShape() {
        int w = 60, h = 40;
        boolean[] fg = new boolean[w * h];
        fill(fg, w, 2, 2, 10, 10);
        fill(fg, w, 5, 30, 55, 32);

        ParticleRegions regions = ParticleRegions.analyze(fg, w, h, 1);
        boolean[] bars = regions.pixels(r -> regions.aspectRatio(r) >= 3);

        assertEquals(100, HoughLineTransform.count(bars));
        assertFalse(bars[3 * w + 3]);
        assertTrue(bars[31 * w + 30]);
    }

    @Test
    void emptyMaskHasNoRegions() {
        ParticleRegions regions = ParticleRegions.analyze(new boolean[100], 10, 10, 1);

        assertEquals(0, regions.count());
        assertEquals(0, HoughLineTransform.count(regions.pixels()));
    }

    @Test
    void interiorHolesStayClear() {
        int w = 20, h = 20;
        boolean[] fg = new boolean[w * h];
        fill(fg, w, 4, 4, 14, 14);
        for (int y = 7; y < 11; y++) for (int x = 7; x < 11; x++) fg[y * w + x] = false;

        boolean[] kept = ParticleRegions.analyze(fg, w, h, 1).pixels();

        assertFalse(kept[8 * w + 8]);
        assertEquals(100 - 16, HoughLineTransform.count(kept));
    }
}
