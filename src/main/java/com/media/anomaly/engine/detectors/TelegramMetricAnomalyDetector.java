package com.media.anomaly.engine.detectors;

import com.media.anomaly.cache.TelegramPredictionCache;
import com.media.anomaly.engine.AnomalyDetector;
import com.media.anomaly.engine.ArticleFields;
import com.media.anomaly.engine.DetectorType;
import com.media.anomaly.model.Anomaly;
import com.media.anomaly.model.Article;
import com.media.anomaly.model.Coefficients;
import com.media.anomaly.model.Prediction;
import com.media.anomaly.model.Statistic;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Detects unusual engagement on a Telegram post.
 *
 * Two checks run once the channel's coefficients are known and the post has at least the
 * channel's minimal views:
 * <ul>
 *   <li>static ratios: forwards/views and reactions/views against the channel coefficients,
 *       scored with {@code 1 / (1 + e^((expected - ratio) * 10))}</li>
 *   <li>predicted views: views above the upper bound of the predicted bucket, scored with a
 *       sigmoid over the z-score of views/predicted against the window statistics</li>
 * </ul>
 * Posts with zero views never reach the ratio math: zero counts as a missing field.
 */
@Component
public class TelegramMetricAnomalyDetector implements AnomalyDetector {

    public static final String FORWARDS_BY_VIEWS = "forwards_by_views";
    public static final String REACTION_COUNT_BY_VIEWS = "reaction_count_by_views";
    public static final String VIEWS = "views";

    static final int STATIC_METRICS_WEIGHT = 100;
    static final int PREDICTED_METRICS_WEIGHT = 200;

    private static final double STATIC_STEEPNESS = 10.0;
    private static final double PREDICTED_STRETCH = 1.5;
    private static final double PREDICTED_OFFSET = 2.0;

    private final TelegramPredictionCache predictionCache;

    public TelegramMetricAnomalyDetector(TelegramPredictionCache predictionCache) {
        this.predictionCache = predictionCache;
    }

    @Override
    public DetectorType getType() {
        return DetectorType.TELEGRAM_METRICS;
    }

    @Override
    public void run(Article article, List<Anomaly> anomalies) {
        if (!ArticleFields.allPresent(article.getChatId(), article.getDelta(), article.getLoadingDate(),
                article.getViews(), article.getForwards(), article.getReactionCount())) {
            return;
        }

        Coefficients coefficients = predictionCache.getCoefficients(article.getChatId());
        if (coefficients == null) {
            return;
        }

        // Low-traffic posts are too noisy for ratio checks
        if (article.getViews() < coefficients.minimalViewsThresholdOrZero()) {
            return;
        }

        checkStaticMetrics(article, coefficients, anomalies);
        checkPredictedMetrics(article, anomalies);
    }

    private void checkStaticMetrics(Article article, Coefficients coefficients, List<Anomaly> anomalies) {
        double views = article.getViews();

        checkRatio(FORWARDS_BY_VIEWS, article.getForwards() / views,
                coefficients.getForwardsByViews(), anomalies);
        checkRatio(REACTION_COUNT_BY_VIEWS, article.getReactionCount() / views,
                coefficients.getReactionCountByViews(), anomalies);
    }

    private void checkRatio(String metricName, double ratio, Double expected, List<Anomaly> anomalies) {
        if (expected == null || ratio <= expected) {
            return;
        }

        anomalies.add(Anomaly.builder()
                .metricName(metricName)
                .metricValue(ratio)
                .expectedValue(expected)
                .score(scoreStaticMetric(ratio, expected))
                .weight(STATIC_METRICS_WEIGHT)
                .build());
    }

    private void checkPredictedMetrics(Article article, List<Anomaly> anomalies) {
        Prediction prediction = predictionCache.getPrediction(
                article.getLoadingDate(), article.getChatId(), article.getDelta());
        if (prediction == null || prediction.getViews() == null || prediction.getViewsUpper() == null) {
            return;
        }

        long views = article.getViews();
        if (views <= prediction.getViewsUpper()) {
            return;
        }

        Statistic statistic = predictionCache.getStatistics(
                article.getLoadingDate(), article.getChatId(), article.getDelta(), VIEWS);

        anomalies.add(Anomaly.builder()
                .metricName(VIEWS)
                .metricValue(views)
                .expectedValue(prediction.getViews())
                .score(scorePredictedMetric(views, prediction.getViews(), statistic))
                .weight(PREDICTED_METRICS_WEIGHT)
                .build());
    }

    static double scoreStaticMetric(double metricValue, double expectedValue) {
        return 1.0 / (1.0 + Math.exp((expectedValue - metricValue) * STATIC_STEEPNESS));
    }

    static double scorePredictedMetric(double metricValue, double expectedValue, Statistic statistic) {
        double deviation = metricValue / expectedValue;

        double zScore = deviation;
        if (statistic != null && statistic.getMean() != null
                && statistic.getStd() != null && statistic.getStd() > 0) {
            zScore = (deviation - statistic.getMean()) / statistic.getStd();
        }

        return 1.0 / (1.0 + Math.exp(-zScore / PREDICTED_STRETCH + PREDICTED_OFFSET));
    }
}
