package com.media.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDetection(String outcome, double totalScore) {
        Counter.builder("detection.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        DistributionSummary.builder("detection.total_score")
                .tag("outcome", outcome)
                .register(registry)
                .record(totalScore);
    }

    public void recordAnomaly(String metricName) {
        Counter.builder("anomaly.detected.count")
                .tag("metric", metricName)
                .register(registry)
                .increment();
    }

    public void recordDetectorFailure(String detector) {
        Counter.builder("detector.failure.count")
                .tag("detector", detector)
                .register(registry)
                .increment();
    }

    public void recordCacheRefill(String cache, int rows) {
        Counter.builder("cache.refill.count")
                .tag("cache", cache)
                .register(registry)
                .increment();

        DistributionSummary.builder("cache.refill.rows")
                .tag("cache", cache)
                .register(registry)
                .record(rows);
    }

    public void recordAlertPublished(String status) {
        Counter.builder("alert.published.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordLinkFailure() {
        Counter.builder("link.failure.count")
                .register(registry)
                .increment();
    }
}
