package com.orbitalsky.config;

import java.util.Locale;

public enum DetectorType {
    BASELINE,
    IMPROVED,
    ADAPTIVE;

    /** Case-insensitive lookup; blank or unknown names give ADAPTIVE. */
    public static DetectorType parse(String name) {
        if (name == null || name.isBlank()) return ADAPTIVE;
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ADAPTIVE;
        }
    }
}
