package com.media.anomaly.link;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Resolves deep links to the raw data behind an alert.
 */
public interface LinkGenerator {

    /**
     * @param destination index the article was written to
     * @param mapping     field -> value equality conditions, combined with "and"
     * @param date        center of the time window shown by the link
     * @return links in resolution order, possibly empty
     */
    List<String> generate(String destination, Map<String, String> mapping, LocalDateTime date);
}
