package com.media.anomaly.repository;

import com.media.anomaly.entity.TelegramCoefficientEntity;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;

import java.util.List;

public interface TelegramCoefficientRepository extends JpaRepository<TelegramCoefficientEntity, Long> {

    @Query("SELECT c FROM TelegramCoefficientEntity c")
    @QueryHints(@QueryHint(name = StoreQueryHints.TIMEOUT, value = StoreQueryHints.TIMEOUT_MS))
    List<TelegramCoefficientEntity> loadAll();
}
