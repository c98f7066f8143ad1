package com.media.anomaly.engine;

import com.media.anomaly.model.Anomaly;
import com.media.anomaly.model.Article;

import java.util.List;

/**
 * A single anomaly check over one article.
 *
 * Implementations must not mutate the article, must return quietly when any of their
 * required fields is missing, and must not depend on anomalies appended by other detectors.
 */
public interface AnomalyDetector {

    DetectorType getType();

    /**
     * Inspect the article and append zero or more anomalies.
     *
     * @param article   the article payload
     * @param anomalies accumulator shared by all detectors for this article
     */
    void run(Article article, List<Anomaly> anomalies);
}
