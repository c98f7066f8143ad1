package com.media.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder
@Schema(description = "A single deviation found by a detector")
public class Anomaly {

    public static final int DEFAULT_WEIGHT = 100;

    @Schema(description = "Name of the deviating metric", example = "forwards_by_views")
    String metricName;

    @Schema(description = "Observed value (number, or string for categorical anomalies)", example = "0.2")
    Object metricValue;

    @Schema(description = "Expected value, if the detector has one", example = "0.1")
    Object expectedValue;

    @Schema(description = "Detector-produced score in [0, 1]", example = "0.97")
    double score;

    @Schema(description = "Informational weight of the check kind; not used for ranking", example = "100")
    @Builder.Default
    int weight = DEFAULT_WEIGHT;

    /**
     * Transport form: every field rendered as a string, keys in snake_case.
     */
    public Map<String, String> toTransport() {
        Map<String, String> out = new LinkedHashMap<>();
        out.put("metric_name", TransportValues.render(metricName));
        out.put("metric_value", TransportValues.render(metricValue));
        out.put("expected_value", TransportValues.render(expectedValue));
        out.put("score", TransportValues.render(score));
        out.put("weight", TransportValues.render(weight));
        return out;
    }
}
