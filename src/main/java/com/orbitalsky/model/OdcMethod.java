package com.orbitalsky.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OdcMethod {
    PERCENTILE_BASELINE("percentile_baseline"),
    PHYSICAL_MODEL("physical_model+percentile_fallback"),
    // el modelo físico se intentó pero falló
    PERCENTILE_FALLBACK("percentile_baseline(physical_model_failed)"),
    NONE("none");

    private final String tag;

    OdcMethod(String tag) { this.tag = tag; }

    @JsonValue
    public String tag() { return tag; }
}
