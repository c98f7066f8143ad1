package com.media.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "kibana")
public class KibanaConfig {

    private boolean enabled = false;
    private String baseUrl;
    private String apiKey;

    // index -> {dataview -> space} resolution cache
    private long objectCacheSize = 1000;
    private Duration objectCacheRetention = Duration.ofDays(1);
}
