package com.orbitalsky.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/** What happened to one frame of a batch. Only SUCCESS and DEGRADED frames carry a quality record. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FrameOutcome {
    public enum Status { SUCCESS, DEGRADED, SKIPPED }

    public final String file;
    public final Status status;
    public final FrameQuality quality;
    public final String reason;

    private FrameOutcome(String file, Status status, FrameQuality quality, String reason) {
        this.file = file;
        this.status = status;
        this.quality = quality;
        this.reason = reason;
    }

    public static FrameOutcome processed(FrameQuality quality) {
        if (quality.detector.degraded) {
            return new FrameOutcome(quality.file, Status.DEGRADED, quality, quality.detector.failureReason);
        }
        return new FrameOutcome(quality.file, Status.SUCCESS, quality, null);
    }

    public static FrameOutcome skipped(String file, String reason) {
        return new FrameOutcome(file, Status.SKIPPED, null, reason);
    }
}
