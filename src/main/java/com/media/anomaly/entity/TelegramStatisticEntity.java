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
@Table(name = "metrics_telegram_statistic")
@IdClass(TelegramStatisticEntity.Key.class)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class TelegramStatisticEntity {

    @Id
    @Column(name = "date_from", nullable = false)
    private LocalDateTime dateFrom;

    @Id
    @Column(name = "date_to", nullable = false)
    private LocalDateTime dateTo;

    @Id
    @Column(name = "chat_id", nullable = false)
    private Long chatId;

    @Id
    @Column(name = "delta", nullable = false)
    private Integer delta;

    @Id
    @Column(name = "metric", nullable = false)
    private String metric;

    @Column(name = "mean")
    private Double mean;

    @Column(name = "std")
    private Double std;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {
        private LocalDateTime dateFrom;
        private LocalDateTime dateTo;
        private Long chatId;
        private Integer delta;
        private String metric;
    }
}
