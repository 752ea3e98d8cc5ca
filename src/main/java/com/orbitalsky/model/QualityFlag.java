package com.orbitalsky.model;

public enum QualityFlag {
    STREAK_DETECTED,
    HIGH_CONTAMINATION
}
