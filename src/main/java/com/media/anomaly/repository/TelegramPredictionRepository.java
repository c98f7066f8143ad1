package com.media.anomaly.repository;

import com.media.anomaly.entity.TelegramPredictionEntity;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.QueryHints;

import java.time.LocalDateTime;
import java.util.List;

public interface TelegramPredictionRepository
        extends JpaRepository<TelegramPredictionEntity, TelegramPredictionEntity.Key> {

    /**
     * Prediction rows with {@code from <= date <= to}.
     */
    @QueryHints(@QueryHint(name = StoreQueryHints.TIMEOUT, value = StoreQueryHints.TIMEOUT_MS))
    List<TelegramPredictionEntity> findByDateBetween(LocalDateTime from, LocalDateTime to);
}
