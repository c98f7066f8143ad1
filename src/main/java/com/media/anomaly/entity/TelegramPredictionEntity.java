package com.media.anomaly.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;

@Entity
@Table(name = "metrics_telegram_prediction")
@IdClass(TelegramPredictionEntity.Key.class)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class TelegramPredictionEntity {

    @Id
    @Column(name = "date", nullable = false)
    private LocalDateTime date;

    @Id
    @Column(name = "chat_id", nullable = false)
    private Long chatId;

    @Id
    @Column(name = "delta", nullable = false)
    private Integer delta;

    @Column(name = "views")
    private Double views;

    @Column(name = "views_lower")
    private Double viewsLower;

    @Column(name = "views_upper")
    private Double viewsUpper;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {
        private LocalDateTime date;
        private Long chatId;
        private Integer delta;
    }
}
