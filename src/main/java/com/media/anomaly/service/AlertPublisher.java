package com.media.anomaly.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.media.anomaly.config.DetectorConfig;
import com.media.anomaly.config.MetricsConfig;
import com.media.anomaly.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

/**
 * Publishes alerts in their string transport form to the alerts topic, keyed by article id.
 */
@Service
public class AlertPublisher {

    private static final Logger log = LoggerFactory.getLogger(AlertPublisher.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String alertsTopic;
    private final MetricsConfig metricsConfig;

    public AlertPublisher(KafkaTemplate<String, String> kafkaTemplate,
                          ObjectMapper objectMapper,
                          DetectorConfig config,
                          MetricsConfig metricsConfig) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.alertsTopic = config.getKafka().getAlertsTopic();
        this.metricsConfig = metricsConfig;
    }

    public void publish(Alert alert) {
        String payload = serialize(alert);

        kafkaTemplate.send(alertsTopic, alert.getArticleId(), payload)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        metricsConfig.recordAlertPublished("error");
                        log.error("Failed to publish alert {} for article {}: {}",
                                alert.getId(), alert.getArticleId(), ex.getMessage(), ex);
                    } else {
                        metricsConfig.recordAlertPublished("success");
                        log.debug("Alert {} published to {}", alert.getId(), alertsTopic);
                    }
                });
    }

    String serialize(Alert alert) {
        try {
            return objectMapper.writeValueAsString(alert.toTransport());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize alert " + alert.getId(), e);
        }
    }
}
