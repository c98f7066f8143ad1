package com.media.anomaly.controller;

import com.media.anomaly.model.Alert;
import com.media.anomaly.model.ArticleEvent;
import com.media.anomaly.service.AlertPublisher;
import com.media.anomaly.service.AnomalyAggregationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/detections")
@Tag(name = "Detections", description = "Run anomaly detection on a single article event")
public class DetectionController {

    private final AnomalyAggregationService aggregationService;
    private final AlertPublisher alertPublisher;

    public DetectionController(AnomalyAggregationService aggregationService, AlertPublisher alertPublisher) {
        this.aggregationService = aggregationService;
        this.alertPublisher = alertPublisher;
    }

    @Operation(summary = "Evaluate an article event",
            description = "Runs every registered detector against the event payload. Returns the ranked alert " +
                    "when at least one anomaly was found, or 204 when the article looks normal. " +
                    "With publish=true the alert is also sent to the alerts topic.")
    @PostMapping("/evaluate")
    public ResponseEntity<?> evaluate(
            @RequestBody ArticleEvent event,
            @Parameter(description = "Also publish the alert to the alerts topic", example = "false")
            @RequestParam(defaultValue = "false") boolean publish) {
        if (event.getMetadata() == null || event.getPayload() == null) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Event must contain both metadata and payload"));
        }
        if (event.getPayload().getSource() == null || event.getPayload().effectiveDate() == null) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Payload must contain source and date"));
        }

        Alert alert = aggregationService.run(event);
        if (alert == null) {
            return ResponseEntity.noContent().build();
        }

        if (publish) {
            alertPublisher.publish(alert);
        }
        return ResponseEntity.ok(alert);
    }
}
