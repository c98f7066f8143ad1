package com.media.anomaly.link;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.media.anomaly.config.KibanaConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Caches which Kibana data views (and the spaces holding them) cover each index.
 * Unknown indices trigger one full re-scan of spaces and data views.
 */
@Component
public class KibanaObjectCache {

    private static final Logger log = LoggerFactory.getLogger(KibanaObjectCache.class);

    private final RestClient restClient;
    private final boolean enabled;
    private final Cache<String, Map<String, String>> dataviewsByIndex;
    private final ReentrantLock refreshLock = new ReentrantLock();

    public KibanaObjectCache(RestClient.Builder restClientBuilder, KibanaConfig config, Ticker cacheTicker) {
        this.enabled = config.isEnabled();
        if (config.getBaseUrl() != null) {
            restClientBuilder.baseUrl(config.getBaseUrl());
        }
        if (config.getApiKey() != null) {
            restClientBuilder.defaultHeader(HttpHeaders.AUTHORIZATION, "ApiKey " + config.getApiKey());
        }
        this.restClient = restClientBuilder.build();
        this.dataviewsByIndex = CacheBuilder.newBuilder()
                .maximumSize(config.getObjectCacheSize())
                .expireAfterWrite(config.getObjectCacheRetention())
                .ticker(cacheTicker)
                .build();

        if (!enabled) {
            log.info("Kibana link resolution is DISABLED.");
            return;
        }
        try {
            refresh();
        } catch (RestClientException e) {
            // Links are optional; the next unknown index retries the scan
            log.warn("Initial Kibana object scan failed: {}", e.getMessage());
        }
    }

    /**
     * Data views covering the index as {dataviewId -> spaceId}; empty when none do.
     */
    public Map<String, String> getDataviewsByIndex(String index) {
        if (!enabled || index == null) {
            return Map.of();
        }

        Map<String, String> dataviews = dataviewsByIndex.getIfPresent(index);
        if (dataviews != null) {
            return dataviews;
        }

        refreshLock.lock();
        try {
            dataviews = dataviewsByIndex.getIfPresent(index);
            if (dataviews == null) {
                refresh();
                dataviews = dataviewsByIndex.getIfPresent(index);
            }
        } finally {
            refreshLock.unlock();
        }
        return dataviews != null ? dataviews : Map.of();
    }

    void refresh() {
        Map<String, Map<String, String>> objects = new HashMap<>();

        for (String spaceId : fetchSpaceIds()) {
            for (Map.Entry<String, String> dataview : fetchDataviews(spaceId).entrySet()) {
                objects.computeIfAbsent(dataview.getKey(), k -> new LinkedHashMap<>())
                        .put(dataview.getValue(), spaceId);
            }
        }

        objects.forEach((index, dataviews) -> dataviewsByIndex.put(index, Collections.unmodifiableMap(dataviews)));
        log.debug("Kibana objects refreshed: {} indices", objects.size());
    }

    private List<String> fetchSpaceIds() {
        JsonNode spaces = restClient.get()
                .uri("/api/spaces/space")
                .retrieve()
                .body(JsonNode.class);

        List<String> ids = new ArrayList<>();
        if (spaces != null) {
            for (JsonNode space : spaces) {
                ids.add(space.path("id").asText());
            }
        }
        return ids;
    }

    // index title -> data view id
    private Map<String, String> fetchDataviews(String spaceId) {
        JsonNode response = restClient.get()
                .uri("/s/{spaceId}/api/data_views", spaceId)
                .retrieve()
                .body(JsonNode.class);

        Map<String, String> dataviews = new LinkedHashMap<>();
        if (response != null) {
            for (JsonNode dataview : response.path("data_view")) {
                dataviews.put(dataview.path("title").asText(), dataview.path("id").asText());
            }
        }
        return dataviews;
    }
}
