package com.media.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "detector")
public class DetectorConfig {

    // Prediction buckets are aligned to this many minutes (minute - minute % step)
    private int predictionStepMinutes = 5;

    // Predictions table grows fastest, so it gets the big cache
    private CachePolicy predictions = new CachePolicy(500_000, Duration.ofHours(1), Duration.ofHours(1));

    private CachePolicy statistics = new CachePolicy(10_000, Duration.ofHours(1), Duration.ofHours(1));

    private CachePolicy coefficients = new CachePolicy(10_000, Duration.ofHours(1), Duration.ofHours(1));

    // Half-width of the time window placed around the article date in deep links
    private Duration linkTimeWindow = Duration.ofMinutes(5);

    // Ingestion method (event metadata) -> alert domain
    private Map<String, String> domains = new HashMap<>(Map.of(
            "TelegramEngagementExecutor", "Telegram",
            "TelegramListener", "Telegram",
            "opoint", "Web"));

    private String unknownDomain = "Unknown";

    private Severity severity = new Severity();

    private Kafka kafka = new Kafka();

    @Data
    public static class CachePolicy {
        private long maxSize;
        // Half-width of the range queried from the store on a miss
        private Duration updateWindow;
        // Time-to-live from insertion
        private Duration retention;

        public CachePolicy() {
        }

        public CachePolicy(long maxSize, Duration updateWindow, Duration retention) {
            this.maxSize = maxSize;
            this.updateWindow = updateWindow;
            this.retention = retention;
        }
    }

    @Data
    public static class Severity {
        // Thresholds are compared against the unnormalized total score
        private double critical = 0.75;
        private double major = 0.25;
        private double minor = 0.0;
    }

    @Data
    public static class Kafka {
        private String articlesTopic = "data-pipeline-detector";
        private String alertsTopic = "data-pipeline-alerts";
        // Listener threads; each processes one record at a time
        private int concurrency = 1;
    }
}
