package com.media.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI mediaAnomalyDetectorOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Media Anomaly Detector API")
                        .version("1.0.0")
                        .description(
                                "Anomaly detection for ingested articles and Telegram posts.\n\n" +
                                "**Detection Pipeline:**\n" +
                                "1. Receive an article event via `POST /detections/evaluate` (or the articles topic)\n" +
                                "2. Run every registered detector against the payload\n" +
                                "3. Rank anomalies by score and sum them into a total score\n" +
                                "4. Build a templated description and a Kibana deep link\n\n" +
                                "**Detectors:**\n" +
                                "- `TELEGRAM_METRICS`: forwards/reactions ratios against per-channel coefficients, " +
                                "views against predicted upper bounds\n" +
                                "- `TELEGRAM_REPOST`: reposts whose origin channel is registered in another country\n\n" +
                                "**Severity:** Critical (>0.75), Major (>0.25), Minor (>0), Warning otherwise")
                        .contact(new Contact().name("Media Monitoring Team")));
    }
}
