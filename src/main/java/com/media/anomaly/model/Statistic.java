package com.media.anomaly.model;

import lombok.Builder;
import lombok.Value;

/**
 * Distribution of observed/predicted ratios for one metric over a date window.
 */
@Value
@Builder
public class Statistic {
    Double mean;
    Double std;
}
