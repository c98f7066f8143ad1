package com.media.anomaly.cache;

import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.media.anomaly.config.DetectorConfig;
import com.media.anomaly.config.MetricsConfig;
import com.media.anomaly.entity.TelegramCoefficientEntity;
import com.media.anomaly.entity.TelegramPredictionEntity;
import com.media.anomaly.entity.TelegramStatisticEntity;
import com.media.anomaly.model.Coefficients;
import com.media.anomaly.model.Prediction;
import com.media.anomaly.model.Statistic;
import com.media.anomaly.repository.TelegramCoefficientRepository;
import com.media.anomaly.repository.TelegramPredictionRepository;
import com.media.anomaly.repository.TelegramStatisticRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Read-through cache over the three Telegram baseline tables (predictions, statistics,
 * coefficients).
 *
 * Each table has its own size and time-to-live policy. A lookup that misses triggers exactly
 * one bounded refill from the store and one re-check; a second miss means the baseline does
 * not exist. Predictions and statistics are refilled with a window around the requested date,
 * coefficients with a full-table reload.
 *
 * Store failures are not caught here: they propagate to the detector asking for the baseline.
 * Refills read every row before writing any of them, so a failed refill leaves the cache as it was.
 * Refills of the same table are serialized by one lock per table.
 */
@Component
public class TelegramPredictionCache {

    private static final Logger log = LoggerFactory.getLogger(TelegramPredictionCache.class);

    static final String PREDICTIONS = "predictions";
    static final String STATISTICS = "statistics";
    static final String COEFFICIENTS = "coefficients";

    private final TelegramPredictionRepository predictionRepository;
    private final TelegramStatisticRepository statisticRepository;
    private final TelegramCoefficientRepository coefficientRepository;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final int predictionStepMinutes;
    private final Duration predictionUpdateWindow;

    private final Cache<PredictionKey, Prediction> predictions;
    private final Cache<StatisticKey, Statistic> statistics;
    private final Cache<Long, Coefficients> coefficients;

    private final ReentrantLock predictionRefillLock = new ReentrantLock();
    private final ReentrantLock statisticRefillLock = new ReentrantLock();
    private final ReentrantLock coefficientRefillLock = new ReentrantLock();

    public TelegramPredictionCache(TelegramPredictionRepository predictionRepository,
                                   TelegramStatisticRepository statisticRepository,
                                   TelegramCoefficientRepository coefficientRepository,
                                   DetectorConfig config,
                                   MetricsConfig metricsConfig,
                                   Clock clock,
                                   Ticker cacheTicker) {
        if (config.getPredictionStepMinutes() < 1 || config.getPredictionStepMinutes() > 60) {
            throw new IllegalArgumentException(
                    "detector.prediction-step-minutes must be within 1..60, got " + config.getPredictionStepMinutes());
        }

        this.predictionRepository = predictionRepository;
        this.statisticRepository = statisticRepository;
        this.coefficientRepository = coefficientRepository;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        this.predictionStepMinutes = config.getPredictionStepMinutes();
        this.predictionUpdateWindow = config.getPredictions().getUpdateWindow();

        this.predictions = buildCache(config.getPredictions(), cacheTicker);
        this.statistics = buildCache(config.getStatistics(), cacheTicker);
        this.coefficients = buildCache(config.getCoefficients(), cacheTicker);

        // Warm up so the first articles after startup don't all pay for a refill
        LocalDateTime now = LocalDateTime.now(clock);
        refillPredictions(now.minus(predictionUpdateWindow), now.plus(predictionUpdateWindow));
        refillStatistics(now);
        refillCoefficients();

        log.info("Baseline cache warmed up: predictions={}, statistics={}, coefficients={}",
                predictions.size(), statistics.size(), coefficients.size());
    }

    /**
     * Prediction for the bucket containing {@code date}, or null when none exists.
     */
    public Prediction getPrediction(LocalDateTime date, long chatId, int delta) {
        LocalDateTime bucket = roundToBucket(date);
        PredictionKey key = new PredictionKey(bucket, chatId, delta);

        Prediction prediction = predictions.getIfPresent(key);
        if (prediction != null) {
            return prediction;
        }

        predictionRefillLock.lock();
        try {
            // A refill that finished while we waited may already cover this key
            prediction = predictions.getIfPresent(key);
            if (prediction != null) {
                return prediction;
            }
            refillPredictions(bucket.minus(predictionUpdateWindow), bucket.plus(predictionUpdateWindow));
        } finally {
            predictionRefillLock.unlock();
        }

        return predictions.getIfPresent(key);
    }

    /**
     * Statistic of the window that strictly contains {@code date}, or null when none exists.
     * When several windows contain the date, the one ending last wins.
     */
    public Statistic getStatistics(LocalDateTime date, long chatId, int delta, String metric) {
        Statistic statistic = findLatestStatistic(date, chatId, delta, metric);
        if (statistic != null) {
            return statistic;
        }

        statisticRefillLock.lock();
        try {
            statistic = findLatestStatistic(date, chatId, delta, metric);
            if (statistic != null) {
                return statistic;
            }
            refillStatistics(date);
        } finally {
            statisticRefillLock.unlock();
        }

        return findLatestStatistic(date, chatId, delta, metric);
    }

    /**
     * Static coefficients of the chat, or null when the chat has none.
     */
    public Coefficients getCoefficients(long chatId) {
        Coefficients found = coefficients.getIfPresent(chatId);
        if (found != null) {
            return found;
        }

        coefficientRefillLock.lock();
        try {
            found = coefficients.getIfPresent(chatId);
            if (found != null) {
                return found;
            }
            refillCoefficients();
        } finally {
            coefficientRefillLock.unlock();
        }

        return coefficients.getIfPresent(chatId);
    }

    /**
     * Rounds down to the prediction step, dropping seconds. Idempotent.
     */
    public LocalDateTime roundToBucket(LocalDateTime date) {
        int minute = date.getMinute();
        return date.withMinute(minute - minute % predictionStepMinutes)
                .withSecond(0)
                .withNano(0);
    }

    private Statistic findLatestStatistic(LocalDateTime date, long chatId, int delta, String metric) {
        StatisticKey latest = null;
        Statistic latestValue = null;

        // Linear scan; the statistics table is small
        for (Map.Entry<StatisticKey, Statistic> entry : statistics.asMap().entrySet()) {
            StatisticKey key = entry.getKey();
            if (!key.contains(date) || key.chatId() != chatId || key.delta() != delta
                    || !key.metric().equals(metric)) {
                continue;
            }
            if (latest == null || key.dateTo().isAfter(latest.dateTo())) {
                latest = key;
                latestValue = entry.getValue();
            }
        }
        return latestValue;
    }

    private void refillPredictions(LocalDateTime from, LocalDateTime to) {
        List<TelegramPredictionEntity> rows = predictionRepository.findByDateBetween(from, to);

        Map<PredictionKey, Prediction> fresh = new HashMap<>(rows.size());
        for (TelegramPredictionEntity row : rows) {
            PredictionKey key = new PredictionKey(
                    row.getDate().truncatedTo(ChronoUnit.MINUTES), row.getChatId(), row.getDelta());
            fresh.put(key, Prediction.builder()
                    .views(row.getViews())
                    .viewsLower(row.getViewsLower())
                    .viewsUpper(row.getViewsUpper())
                    .build());
        }
        predictions.putAll(fresh);

        metricsConfig.recordCacheRefill(PREDICTIONS, fresh.size());
        log.debug("Predictions refilled for [{} .. {}]: {} rows", from, to, fresh.size());
    }

    private void refillStatistics(LocalDateTime date) {
        List<TelegramStatisticEntity> rows = statisticRepository.findWindowsContaining(date);

        Map<StatisticKey, Statistic> fresh = new HashMap<>(rows.size());
        for (TelegramStatisticEntity row : rows) {
            StatisticKey key = new StatisticKey(
                    row.getDateFrom(), row.getDateTo(), row.getChatId(), row.getDelta(), row.getMetric());
            fresh.put(key, Statistic.builder()
                    .mean(row.getMean())
                    .std(row.getStd())
                    .build());
        }
        statistics.putAll(fresh);

        metricsConfig.recordCacheRefill(STATISTICS, fresh.size());
        log.debug("Statistics refilled at {}: {} rows", date, fresh.size());
    }

    private void refillCoefficients() {
        List<TelegramCoefficientEntity> rows = coefficientRepository.loadAll();

        Map<Long, Coefficients> fresh = new HashMap<>(rows.size());
        for (TelegramCoefficientEntity row : rows) {
            fresh.put(row.getId(), Coefficients.builder()
                    .forwardsByViews(row.getForwardsByViews())
                    .reactionCountByViews(row.getReactionCountByViews())
                    .minimalViewsThreshold(row.getMinimalViewsThreshold())
                    .build());
        }
        coefficients.putAll(fresh);

        metricsConfig.recordCacheRefill(COEFFICIENTS, fresh.size());
        log.debug("Coefficients refilled: {} rows", fresh.size());
    }

    private static <K, V> Cache<K, V> buildCache(DetectorConfig.CachePolicy policy, Ticker ticker) {
        return CacheBuilder.newBuilder()
                .maximumSize(policy.getMaxSize())
                .expireAfterWrite(policy.getRetention())
                .ticker(ticker)
                .build();
    }

    private record PredictionKey(LocalDateTime bucket, long chatId, int delta) {}

    private record StatisticKey(LocalDateTime dateFrom, LocalDateTime dateTo,
                                long chatId, int delta, String metric) {

        boolean contains(LocalDateTime date) {
            return dateFrom.isBefore(date) && date.isBefore(dateTo);
        }
    }
}
