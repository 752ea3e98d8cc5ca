package com.orbitalsky.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a detector reports alongside its mask. {@code candidateRegions} is only filled by detectors with a
 * morphological stage; {@code failureReason} only when the result is degraded.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DetectionMetadata {
    public final String method;
    public final Map<String, Double> parameters;
    public final int detectedLines;
    public final Integer candidateRegions;
    public final boolean degraded;
    public final String failureReason;

    public DetectionMetadata(String method, Map<String, Double> parameters, int detectedLines,
                             Integer candidateRegions, boolean degraded, String failureReason) {
        this.method = method;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.detectedLines = detectedLines;
        this.candidateRegions = candidateRegions;
        this.degraded = degraded;
        this.failureReason = failureReason;
    }

    public static DetectionMetadata of(String method, Map<String, Double> parameters, int detectedLines) {
        return new DetectionMetadata(method, parameters, detectedLines, null, false, null);
    }

    public static DetectionMetadata withCandidates(String method, Map<String, Double> parameters,
                                                   int detectedLines, int candidateRegions) {
        return new DetectionMetadata(method, parameters, detectedLines, candidateRegions, false, null);
    }

    public static DetectionMetadata failed(String method, Map<String, Double> parameters, String reason) {
        return new DetectionMetadata(method, parameters, 0, null, true, reason);
    }
}
