package com.orbitalsky.detection;

/** A line in normal form {@code x*cos(angle) + y*sin(angle) = distance}, with the votes that supported it. */
public class HoughLine {
    public final double angle;    // radianes, [-pi/2, pi/2)
    public final double distance; // píxeles
    public final int votes;

    public HoughLine(double angle, double distance, int votes) {
        this.angle = angle;
        this.distance = distance;
        this.votes = votes;
    }

    public double distanceTo(double x, double y) {
        return Math.abs(x * Math.cos(angle) + y * Math.sin(angle) - distance);
    }
}
