package com.media.anomaly.model;

import lombok.Builder;
import lombok.Value;

/**
 * Static per-channel thresholds.
 */
@Value
@Builder
public class Coefficients {
    Double forwardsByViews;
    Double reactionCountByViews;
    Long minimalViewsThreshold;

    public long minimalViewsThresholdOrZero() {
        return minimalViewsThreshold != null ? minimalViewsThreshold : 0L;
    }
}
