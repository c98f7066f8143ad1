package com.media.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Value
@Builder
@Schema(description = "Aggregated, ranked result of all detectors for one article")
public class Alert {

    @Schema(description = "Alert identifier (UUID)", example = "2f1e4c1a-8e0b-4c55-9a4f-6c1a1b3e2d10")
    String id;

    @Schema(description = "Article loading date, or publication date when not loaded yet", example = "2023-10-25T14:56:37")
    LocalDateTime date;

    @Schema(description = "Sum of all anomaly scores; not normalized and may exceed 1.0", example = "1.42")
    double score;

    @Schema(description = "Domain resolved from the ingestion method", example = "Telegram")
    String domain;

    @Schema(description = "Source of the article (channel, website)", example = "#BEZNAHUBKU")
    String source;

    @Schema(description = "Human-readable summary",
            example = "Critical anomaly in views (5.0x higher) found for #BEZNAHUBKU 3600 seconds after publication")
    String description;

    @Schema(description = "Deep link to the article data, if one could be resolved")
    String url;

    @Schema(description = "Metric of the highest-scoring anomaly", example = "views")
    String fieldName;

    @Schema(description = "Observed value of the highest-scoring anomaly", example = "500")
    Object anomalyValue;

    @Schema(description = "Expected value of the highest-scoring anomaly", example = "100")
    Object expectedValue;

    @Schema(description = "Identifier of the article the alert was raised for")
    String articleId;

    @Schema(description = "All anomalies, highest score first")
    @Singular
    List<Anomaly> allAnomalies;

    /**
     * Transport form published to the alerts topic: scalars rendered as strings,
     * anomalies as an ordered list of string maps.
     */
    public Map<String, Object> toTransport() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", TransportValues.render(id));
        out.put("date", TransportValues.render(date));
        out.put("score", TransportValues.render(score));
        out.put("domain", TransportValues.render(domain));
        out.put("source", TransportValues.render(source));
        out.put("description", TransportValues.render(description));
        out.put("url", TransportValues.render(url));
        out.put("field_name", TransportValues.render(fieldName));
        out.put("anomaly_value", TransportValues.render(anomalyValue));
        out.put("expected_value", TransportValues.render(expectedValue));
        out.put("article_id", TransportValues.render(articleId));
        out.put("all_anomalies", allAnomalies.stream().map(Anomaly::toTransport).toList());
        return out;
    }
}
