package com.media.anomaly.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "metrics_telegram_coefficient")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class TelegramCoefficientEntity {

    // Telegram chat id
    @Id
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "forwards_by_views")
    private Double forwardsByViews;

    @Column(name = "reaction_count_by_views")
    private Double reactionCountByViews;

    @Column(name = "minimal_views_threshold")
    private Long minimalViewsThreshold;
}
