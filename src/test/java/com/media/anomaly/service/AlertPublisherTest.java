package com.media.anomaly.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.media.anomaly.config.DetectorConfig;
import com.media.anomaly.config.MetricsConfig;
import com.media.anomaly.model.Alert;
import com.media.anomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AlertPublisherTest {

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SimpleMeterRegistry registry;
    private AlertPublisher publisher;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        publisher = new AlertPublisher(kafkaTemplate, objectMapper, new DetectorConfig(), new MetricsConfig(registry));
    }

    @Test
    void publish_sendsTransportJsonKeyedByArticleId() throws Exception {
        CompletableFuture<SendResult<String, String>> future = new CompletableFuture<>();
        when(kafkaTemplate.send(eq("data-pipeline-alerts"), eq("article-1"), anyString())).thenReturn(future);

        publisher.publish(alert());
        future.complete(null);

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq("data-pipeline-alerts"), eq("article-1"), payload.capture());
        Map<?, ?> json = objectMapper.readValue(payload.getValue(), Map.class);
        assertThat(json.get("field_name")).isEqualTo("views");
        assertThat(json.get("url")).isEqualTo("None");
        assertThat(json.get("date")).isEqualTo("2023-10-25T14:56:37");
        assertThat(registry.counter("alert.published.count", "status", "success").count()).isEqualTo(1.0);
    }

    @Test
    void publish_countsFailedSends() {
        CompletableFuture<SendResult<String, String>> future = new CompletableFuture<>();
        when(kafkaTemplate.send(eq("data-pipeline-alerts"), eq("article-1"), anyString())).thenReturn(future);

        publisher.publish(alert());
        future.completeExceptionally(new IllegalStateException("broker down"));

        assertThat(registry.counter("alert.published.count", "status", "error").count()).isEqualTo(1.0);
    }

    private static Alert alert() {
        return Alert.builder()
                .id("alert-1")
                .articleId("article-1")
                .date(TestDataFactory.LOADING_DATE)
                .score(0.9)
                .domain("Telegram")
                .source("#BEZNAHUBKU")
                .description("Critical anomaly in views (5.0x higher) found for #BEZNAHUBKU")
                .fieldName("views")
                .anomalyValue(500L)
                .expectedValue(100.0)
                .allAnomaly(TestDataFactory.createAnomaly("views", 500L, 100.0, 0.9))
                .build();
    }
}
