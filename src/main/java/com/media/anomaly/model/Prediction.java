package com.media.anomaly.model;

import lombok.Builder;
import lombok.Value;

/**
 * Predicted views for one (bucket, chat, delta) cell, with its confidence band.
 */
@Value
@Builder
public class Prediction {
    Double views;
    Double viewsLower;
    Double viewsUpper;
}
