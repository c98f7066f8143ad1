package com.media.anomaly.engine;

import com.media.anomaly.config.MetricsConfig;
import com.media.anomaly.model.Anomaly;
import com.media.anomaly.model.Article;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs every registered detector over an article and collects their anomalies.
 * A detector that throws contributes nothing for that article; the others still run.
 */
@Component
public class DetectorEngine {

    private static final Logger log = LoggerFactory.getLogger(DetectorEngine.class);

    private final List<AnomalyDetector> detectors;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public DetectorEngine(List<AnomalyDetector> detectors, Tracer tracer, MetricsConfig metricsConfig) {
        this.detectors = List.copyOf(detectors);
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        for (AnomalyDetector detector : this.detectors) {
            log.info("Registered anomaly detector: {} -> {}",
                    detector.getType(), detector.getClass().getSimpleName());
        }
    }

    /**
     * Run all detectors against the article.
     *
     * @param article  the article payload
     * @param scopeId  identifier used in logs and spans (usually the article id)
     * @return anomalies in the order the detectors produced them
     */
    public List<Anomaly> runAll(Article article, String scopeId) {
        List<Anomaly> anomalies = new ArrayList<>();

        for (AnomalyDetector detector : detectors) {
            Span span = tracer.nextSpan()
                    .name("detector.run." + detector.getType())
                    .tag("detector.type", detector.getType().name())
                    .start();

            // Work on a private list so a failing detector can't leave partial output behind
            List<Anomaly> found = new ArrayList<>();
            try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                detector.run(article, found);
                anomalies.addAll(found);

                span.tag("detector.anomalies", String.valueOf(found.size()));
                for (Anomaly anomaly : found) {
                    metricsConfig.recordAnomaly(anomaly.getMetricName());
                }
            } catch (Exception e) {
                span.error(e);
                metricsConfig.recordDetectorFailure(detector.getType().name());
                log.error("Detector {} failed for article {}: {}",
                        detector.getType(), scopeId, e.getMessage(), e);
            } finally {
                span.end();
            }
        }

        return anomalies;
    }
}
