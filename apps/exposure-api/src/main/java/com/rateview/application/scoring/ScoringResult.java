package com.rateview.application.scoring;

import java.util.List;

/**
 * 점수 계산 실행 결과.
 *
 * @param updated 랭킹이 갱신된 상품 ID (오름차순)
 * @param count 갱신 상품 수
 * @param windowDays 집계 구간(일)
 */
public record ScoringResult(
    List<Long> updated,
    int count,
    int windowDays
) {
    public static ScoringResult of(List<Long> updated, int windowDays) {
        return new ScoringResult(List.copyOf(updated), updated.size(), windowDays);
    }
}
