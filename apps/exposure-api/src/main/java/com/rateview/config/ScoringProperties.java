package com.rateview.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 점수 계산 배치 설정.
 *
 * @param windowDays 집계 구간 일수 (SCORING_WINDOW_DAYS)
 * @param halfLifeDays 참여 지표 감쇠 반감기 (SCORING_HALF_LIFE_DAYS)
 * @param freshnessHalfLife 신선도 감쇠 반감기 (SCORING_FRESHNESS_HALF_LIFE)
 * @param scheduler 주기 실행 설정
 */
@ConfigurationProperties(prefix = "scoring")
public record ScoringProperties(
    int windowDays,
    double halfLifeDays,
    double freshnessHalfLife,
    Scheduler scheduler
) {
    public ScoringProperties {
        scheduler = scheduler == null ? new Scheduler(false, "0 0 * * * *") : scheduler;
    }

    public record Scheduler(
        boolean enabled,
        String cron
    ) {
    }
}
