package com.orbitalsky.utils;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class StatsTest {

    @Test
    void percentileInterpolatesLinearly() {
        double[] v = {4, 1, 3, 2, 5};

        assertEquals(1.0, Stats.percentile(v, 0), 0.0);
        assertEquals(5.0, Stats.percentile(v, 100), 0.0);
        assertEquals(3.0, Stats.percentile(v, 50), 0.0);
        assertEquals(1.2, Stats.percentile(v, 5), 1e-12);
        assertEquals(4.8, Stats.percentile(v, 95), 1e-12);
    }

    @Test
    void percentileDoesNotReorderInput() {
        double[] v = {3, 1, 2};
        Stats.percentile(v, 50);
        assertArrayEquals(new double[]{3, 1, 2}, v, 0.0);
    }

    @Test
    void medianOfEvenSample() {
        assertEquals(2.5, Stats.median(new double[]{1, 2, 3, 4}), 0.0);
    }

    @Test
    void singleValue() {
        assertEquals(7.0, Stats.percentile(new double[]{7}, 13), 0.0);
    }

    @Test
    void emptySampleIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Stats.percentile(new double[0], 50));
    }

    @Test
    void meanAndPopulationStd() {
        double[] v = {2, 4, 4, 4, 5, 5, 7, 9};
        assertEquals(5.0, Stats.mean(v), 0.0);
        assertEquals(2.0, Stats.std(v), 1e-12);
        assertEquals(0.0, Stats.std(new double[0]), 0.0);
    }

    @Test
    void toArrayKeepsOrder() {
        assertArrayEquals(new double[]{1.5, 2.5}, Stats.toArray(Arrays.asList(1.5, 2.5)), 0.0);
    }
}
