package com.media.anomaly.engine;

public enum DetectorType {
    TELEGRAM_METRICS,
    TELEGRAM_REPOST
}
