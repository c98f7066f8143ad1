package com.media.anomaly.repository;

import com.media.anomaly.entity.TelegramStatisticEntity;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

public interface TelegramStatisticRepository
        extends JpaRepository<TelegramStatisticEntity, TelegramStatisticEntity.Key> {

    /**
     * Statistic windows that contain the given date (bounds inclusive).
     */
    @Query("SELECT s FROM TelegramStatisticEntity s WHERE s.dateFrom <= :date AND s.dateTo >= :date")
    @QueryHints(@QueryHint(name = StoreQueryHints.TIMEOUT, value = StoreQueryHints.TIMEOUT_MS))
    List<TelegramStatisticEntity> findWindowsContaining(@Param("date") LocalDateTime date);
}
