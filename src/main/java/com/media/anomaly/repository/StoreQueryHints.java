package com.media.anomaly.repository;

/**
 * Query hints shared by the baseline repositories. Refills run inline with detection,
 * so every read is bounded.
 */
final class StoreQueryHints {

    static final String TIMEOUT = "jakarta.persistence.query.timeout";
    static final String TIMEOUT_MS = "5000";

    private StoreQueryHints() {}
}
