package com.orbitalsky.model;

import java.util.Collections;
import java.util.List;

public class ValidationReport {
    public final String detector;
    public final String dataset;
    public final ValidationSummary summary;
    public final List<DetectionMetrics> perFrame;

    public ValidationReport(String detector, String dataset, ValidationSummary summary, List<DetectionMetrics> perFrame) {
        this.detector = detector;
        this.dataset = dataset;
        this.summary = summary;
        this.perFrame = Collections.unmodifiableList(perFrame);
    }
}
