package com.media.anomaly.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.media.anomaly.model.Alert;
import com.media.anomaly.model.ArticleEvent;
import com.media.anomaly.service.AlertPublisher;
import com.media.anomaly.service.AnomalyAggregationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.stereotype.Component;

/**
 * Consumes article events one at a time and publishes an alert for each anomalous one.
 * Unparseable records are rethrown so the listener container's error handler decides on
 * redelivery.
 */
@Component
public class ArticleEventConsumer {

    private static final Logger log = LoggerFactory.getLogger(ArticleEventConsumer.class);

    private final AnomalyAggregationService aggregationService;
    private final AlertPublisher alertPublisher;
    private final ObjectMapper objectMapper;

    public ArticleEventConsumer(AnomalyAggregationService aggregationService,
                                AlertPublisher alertPublisher,
                                ObjectMapper objectMapper) {
        this.aggregationService = aggregationService;
        this.alertPublisher = alertPublisher;
        this.objectMapper = objectMapper;
    }

    @KafkaListener(
            topics = "${detector.kafka.articles-topic}",
            concurrency = "${detector.kafka.concurrency:1}"
    )
    public void onMessage(
            String message,
            @Header(name = KafkaHeaders.OFFSET, required = false) Long offset) throws JsonProcessingException {

        ArticleEvent event = objectMapper.readValue(message, ArticleEvent.class);
        String articleId = event.getMetadata() != null ? event.getMetadata().getId() : null;

        Alert alert = aggregationService.run(event);
        if (alert == null) {
            log.debug("Message {} (offset={}) has no alerts", articleId, offset);
            return;
        }

        alertPublisher.publish(alert);
    }
}
