package com.media.anomaly.link;

import com.media.anomaly.config.DetectorConfig;
import com.media.anomaly.config.KibanaConfig;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds Kibana Discover links: one per data view covering the destination index, each
 * showing the query over a window centered on the article date.
 */
@Component
public class KibanaLinkGenerator implements LinkGenerator {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.000'Z'");

    private final KibanaObjectCache objectCache;
    private final String baseUrl;
    private final Duration timeWindow;

    public KibanaLinkGenerator(KibanaObjectCache objectCache, KibanaConfig kibanaConfig, DetectorConfig detectorConfig) {
        this.objectCache = objectCache;
        this.baseUrl = kibanaConfig.getBaseUrl();
        this.timeWindow = detectorConfig.getLinkTimeWindow();
    }

    @Override
    public List<String> generate(String destination, Map<String, String> mapping, LocalDateTime date) {
        Map<String, String> dataviews = objectCache.getDataviewsByIndex(destination);
        if (dataviews.isEmpty()) {
            return List.of();
        }

        String query = buildQuery(mapping);
        LocalDateTime from = date.minus(timeWindow);
        LocalDateTime to = date.plus(timeWindow);

        return dataviews.entrySet().stream()
                .map(dataview -> buildUrl(query, dataview.getValue(), dataview.getKey(), from, to))
                .toList();
    }

    /**
     * KQL "and" query. Values are used verbatim; callers quote them when needed.
     */
    static String buildQuery(Map<String, String> mapping) {
        return mapping.entrySet().stream()
                .map(entry -> entry.getKey() + " : " + entry.getValue())
                .collect(Collectors.joining(" and "));
    }

    private String buildUrl(String query, String spaceId, String dataviewId, LocalDateTime from, LocalDateTime to) {
        String encodedQuery = URLEncoder.encode(query, StandardCharsets.UTF_8);

        return baseUrl + "/s/" + spaceId + "/app/discover#/"
                + "?_g=(time:(from:'" + TIME_FORMAT.format(from) + "',to:'" + TIME_FORMAT.format(to) + "'))"
                + "&_a=(index:" + dataviewId + ",query:(language:kuery,query:'" + encodedQuery + "'))";
    }
}
