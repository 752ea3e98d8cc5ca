package com.orbitalsky.detection;

import com.orbitalsky.model.Mask;

/**
 * Turns a frame image into a contamination mask. Implementations never throw on a well-formed 2-D image:
 * internal failures come back as an empty mask whose metadata is marked degraded.
 */
public interface StreakDetector {

    /**
     * @param image pixel intensities indexed {@code image[y][x]}; non-finite values are allowed
     * @return a fresh mask of the same shape
     * @throws IllegalArgumentException if {@code image} is empty or not rectangular
     */
    Mask detect(double[][] image);

    /** Method tag written to the mask metadata. */
    String name();
}
