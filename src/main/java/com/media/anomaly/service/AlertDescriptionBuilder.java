package com.media.anomaly.service;

import com.media.anomaly.config.DetectorConfig;
import com.media.anomaly.engine.ArticleFields;
import com.media.anomaly.model.Anomaly;
import com.media.anomaly.model.Article;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Templated alert text, e.g.
 * {@code Critical anomaly in views (5.0x higher) and forward (0.00x expected) found for #channel 3600 seconds after publication}.
 */
@Component
public class AlertDescriptionBuilder {

    private final DetectorConfig.Severity severity;

    public AlertDescriptionBuilder(DetectorConfig config) {
        this.severity = config.getSeverity();
    }

    /**
     * @param anomalies  anomalies in the order they should be listed (highest score first)
     * @param article    the article the alert is raised for
     * @param totalScore unnormalized sum of the anomaly scores
     */
    public String build(List<Anomaly> anomalies, Article article, double totalScore) {
        List<String> points = new ArrayList<>(anomalies.size());
        for (Anomaly anomaly : anomalies) {
            points.add(describe(anomaly));
        }

        StringBuilder text = new StringBuilder()
                .append(severityPrefix(totalScore))
                .append(" in ")
                .append(joinPoints(points))
                .append(" found for ")
                .append(article.getSource());

        if (ArticleFields.isPresent(article.getDelta())) {
            text.append(' ').append(article.getDelta()).append(" seconds after publication");
        }
        return text.toString();
    }

    String severityPrefix(double totalScore) {
        if (totalScore > severity.getCritical()) return "Critical anomaly";
        if (totalScore > severity.getMajor()) return "Major anomaly";
        if (totalScore > severity.getMinor()) return "Minor anomaly";
        return "Warning anomaly";
    }

    static String describe(Anomaly anomaly) {
        Object value = anomaly.getMetricValue();
        Object expected = anomaly.getExpectedValue();

        if (value instanceof Number number && expected instanceof Number expectedNumber) {
            double expectedDouble = expectedNumber.doubleValue();
            if (expectedDouble == 0.0) {
                return String.format(Locale.ROOT, "%s (%.2fx expected)", anomaly.getMetricName(), expectedDouble);
            }
            double difference = number.doubleValue() / expectedDouble;
            return String.format(Locale.ROOT, "%s (%.1fx higher)", anomaly.getMetricName(), difference);
        }

        // Categorical values, or numbers without a baseline to compare against
        return anomaly.getMetricName() + " is " + value;
    }

    static String joinPoints(List<String> points) {
        if (points.size() == 1) return points.get(0);

        String head = String.join(", ", points.subList(0, points.size() - 1));
        return head + " and " + points.get(points.size() - 1);
    }
}
