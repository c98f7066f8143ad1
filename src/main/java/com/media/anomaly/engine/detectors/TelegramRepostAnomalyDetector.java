package com.media.anomaly.engine.detectors;

import com.media.anomaly.engine.AnomalyDetector;
import com.media.anomaly.engine.ArticleFields;
import com.media.anomaly.engine.DetectorType;
import com.media.anomaly.model.Anomaly;
import com.media.anomaly.model.Article;
import com.media.anomaly.repository.SourceCountryRepository;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Flags reposts whose original channel is registered in a different country than the
 * reposting channel. Categorical signal: score is always 1.0.
 */
@Component
public class TelegramRepostAnomalyDetector implements AnomalyDetector {

    public static final String FORWARD = "forward";

    // Placeholder the enrichment job writes for channels without a known country
    private static final String UNKNOWN_COUNTRY = "xx";

    private final SourceCountryRepository sourceCountryRepository;

    public TelegramRepostAnomalyDetector(SourceCountryRepository sourceCountryRepository) {
        this.sourceCountryRepository = sourceCountryRepository;
    }

    @Override
    public DetectorType getType() {
        return DetectorType.TELEGRAM_REPOST;
    }

    @Override
    public void run(Article article, List<Anomaly> anomalies) {
        if (!ArticleFields.allPresent(article.getCountry(), article.getForwardFromChatId())) {
            return;
        }

        String originalCountry = article.getCountry();
        if (isUnknown(originalCountry)) {
            return;
        }

        String forwardCountry = sourceCountryRepository.findCountry(article.getForwardFromChatId());
        if (isUnknown(forwardCountry) || originalCountry.equalsIgnoreCase(forwardCountry)) {
            return;
        }

        anomalies.add(Anomaly.builder()
                .metricName(FORWARD)
                .metricValue(1)
                .expectedValue(0)
                .score(1.0)
                .build());
    }

    private static boolean isUnknown(String country) {
        return country == null || country.isBlank() || UNKNOWN_COUNTRY.equalsIgnoreCase(country.trim());
    }
}
