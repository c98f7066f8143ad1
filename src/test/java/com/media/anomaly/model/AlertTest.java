package com.media.anomaly.model;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.media.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AlertTest {

    @Test
    void toTransport_rendersEveryValueAsString() {
        Alert alert = Alert.builder()
                .id("alert-1")
                .articleId("article-1")
                .date(TestDataFactory.LOADING_DATE)
                .score(1.25)
                .domain("Telegram")
                .source("#BEZNAHUBKU")
                .description("Critical anomaly")
                .fieldName("views")
                .anomalyValue(500L)
                .expectedValue(100.0)
                .allAnomaly(TestDataFactory.createAnomaly("views", 500L, 100.0, 0.9))
                .allAnomaly(TestDataFactory.createAnomaly("country", "ru", null, 0.35))
                .build();

        Map<String, Object> transport = alert.toTransport();

        assertThat(transport).containsEntry("date", "2023-10-25T14:56:37")
                .containsEntry("score", "1.25")
                .containsEntry("url", "None")
                .containsEntry("anomaly_value", "500")
                .containsEntry("expected_value", "100.0")
                .containsEntry("field_name", "views")
                .containsEntry("article_id", "article-1");
        assertThat(transport.keySet()).startsWith("id", "date", "score");
    }

    @Test
    void toTransport_survivesJsonRoundTrip() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        Alert alert = Alert.builder()
                .id("alert-1")
                .date(TestDataFactory.LOADING_DATE)
                .score(1.65)
                .allAnomaly(TestDataFactory.createAnomaly("forward", 1, 0, 1.0))
                .allAnomaly(Anomaly.builder().metricName("views").metricValue(500L).expectedValue(100.0)
                        .score(0.5).weight(200).build())
                .allAnomaly(TestDataFactory.createAnomaly("country", "ru", null, 0.15))
                .build();

        Map<String, Object> decoded = mapper.readValue(mapper.writeValueAsString(alert.toTransport()),
                new TypeReference<>() {});

        @SuppressWarnings("unchecked")
        List<Map<String, String>> anomalies = (List<Map<String, String>>) decoded.get("all_anomalies");
        assertThat(anomalies).extracting(anomaly -> anomaly.get("metric_name"))
                .containsExactly("forward", "views", "country");
        assertThat(anomalies.get(0)).containsExactly(
                Map.entry("metric_name", "forward"),
                Map.entry("metric_value", "1"),
                Map.entry("expected_value", "0"),
                Map.entry("score", "1.0"),
                Map.entry("weight", "100"));
        assertThat(anomalies.get(1)).containsEntry("metric_value", "500")
                .containsEntry("expected_value", "100.0")
                .containsEntry("score", "0.5")
                .containsEntry("weight", "200");
        assertThat(anomalies.get(2)).containsEntry("metric_value", "ru")
                .containsEntry("expected_value", "None")
                .containsEntry("score", "0.15");
        assertThat(decoded).containsEntry("score", "1.65")
                .containsEntry("domain", "None");
    }
}
