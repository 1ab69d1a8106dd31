package com.rateview.infrastructure.scheduler;

import com.rateview.application.scoring.ScoringResult;
import com.rateview.application.scoring.ScoringService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 점수 계산 주기 실행 스케줄러.
 * <p>
 * {@code scoring.scheduler.enabled=true}일 때만 등록되며, {@code scoring.scheduler.cron} 주기로
 * 기본 집계 구간의 점수 계산을 실행합니다. 실패하면 로그만 남기고 다음 주기에 다시 실행합니다.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "scoring.scheduler", name = "enabled", havingValue = "true")
public class ScoringScheduler {

    private final ScoringService scoringService;

    @Scheduled(cron = "${scoring.scheduler.cron:0 0 * * * *}", zone = "UTC")
    public void runScoring() {
        try {
            ScoringResult result = scoringService.runScoring();
            log.info("주기 점수 계산 완료: windowDays={}, updated={}", result.windowDays(), result.count());
        } catch (Exception e) {
            log.warn("주기 점수 계산 실패, 다음 주기에 재시도", e);
        }
    }
}
