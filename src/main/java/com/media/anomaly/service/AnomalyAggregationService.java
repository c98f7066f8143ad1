package com.media.anomaly.service;

import com.media.anomaly.config.DetectorConfig;
import com.media.anomaly.config.MetricsConfig;
import com.media.anomaly.engine.ArticleFields;
import com.media.anomaly.engine.DetectorEngine;
import com.media.anomaly.link.LinkGenerator;
import com.media.anomaly.model.Alert;
import com.media.anomaly.model.Anomaly;
import com.media.anomaly.model.Article;
import com.media.anomaly.model.ArticleEvent;
import com.media.anomaly.model.EventMetadata;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Turns the anomalies found for one article into a single ranked alert.
 *
 * Flow:
 * 1. Run every detector over the event payload
 * 2. No anomalies: no alert
 * 3. Rank anomalies by score (stable), total score = plain sum
 * 4. Headline fields from the top anomaly, templated description, deep link
 */
@Service
public class AnomalyAggregationService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyAggregationService.class);

    private static final Comparator<Anomaly> BY_SCORE_DESC =
            Comparator.comparingDouble(Anomaly::getScore).reversed();

    private final DetectorEngine detectorEngine;
    private final AlertDescriptionBuilder descriptionBuilder;
    private final LinkGenerator linkGenerator;
    private final DetectorConfig config;
    private final MetricsConfig metricsConfig;

    public AnomalyAggregationService(DetectorEngine detectorEngine,
                                     AlertDescriptionBuilder descriptionBuilder,
                                     LinkGenerator linkGenerator,
                                     DetectorConfig config,
                                     MetricsConfig metricsConfig) {
        this.detectorEngine = detectorEngine;
        this.descriptionBuilder = descriptionBuilder;
        this.linkGenerator = linkGenerator;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Run detection for one event.
     *
     * @return the alert, or null when no detector found anything
     */
    @Observed(name = "detection.run", contextualName = "run-detection")
    public Alert run(ArticleEvent event) {
        if (event.getMetadata() == null || event.getPayload() == null) {
            throw new IllegalArgumentException("Event must carry both metadata and payload");
        }

        EventMetadata metadata = event.getMetadata();
        Article article = event.getPayload();

        List<Anomaly> anomalies = detectorEngine.runAll(article, metadata.getId());
        if (anomalies.isEmpty()) {
            metricsConfig.recordDetection("CLEAN", 0.0);
            log.debug("No anomalies for article={} source={}", metadata.getId(), article.getSource());
            return null;
        }

        // List.sort is stable: equal scores keep detector order
        List<Anomaly> ranked = new ArrayList<>(anomalies);
        ranked.sort(BY_SCORE_DESC);

        // Deliberately not normalized, severity thresholds are calibrated on the raw sum
        double totalScore = 0.0;
        for (Anomaly anomaly : ranked) {
            totalScore += anomaly.getScore();
        }

        Anomaly top = ranked.get(0);
        LocalDateTime date = article.effectiveDate();

        Alert alert = Alert.builder()
                .id(UUID.randomUUID().toString())
                .articleId(metadata.getId())
                .date(date)
                .score(totalScore)
                .domain(config.getDomains().getOrDefault(metadata.getMethod(), config.getUnknownDomain()))
                .source(article.getSource())
                .description(descriptionBuilder.build(ranked, article, totalScore))
                .url(resolveUrl(metadata, article, date))
                .fieldName(top.getMetricName())
                .anomalyValue(top.getMetricValue())
                .expectedValue(top.getExpectedValue())
                .allAnomalies(ranked)
                .build();

        metricsConfig.recordDetection("ALERT", totalScore);
        log.info("Anomaly detected for article={}, source={}: score={}, top={}, anomalies={}",
                metadata.getId(), article.getSource(), totalScore, top.getMetricName(), ranked.size());

        return alert;
    }

    private String resolveUrl(EventMetadata metadata, Article article, LocalDateTime date) {
        String destination = metadata.primaryDestination();
        if (destination == null || date == null) {
            return null;
        }

        Map<String, String> mapping = new LinkedHashMap<>();
        mapping.put("source", "\"" + article.getSource() + "\"");
        if (ArticleFields.isPresent(article.getDelta())) {
            mapping.put("delta", String.valueOf(article.getDelta()));
        }

        try {
            List<String> links = linkGenerator.generate(destination, mapping, date);
            return links.isEmpty() ? null : links.get(0);
        } catch (RuntimeException e) {
            // A missing link never blocks the alert
            metricsConfig.recordLinkFailure();
            log.warn("Link resolution failed for article={} destination={}: {}",
                    metadata.getId(), destination, e.getMessage());
            return null;
        }
    }
}
