package com.rateview.domain.exposure;

/**
 * 노출 구성 정책 값.
 *
 * @param popularityWeight 인기도 가중치
 * @param strategicWeight 전략(콜드/신선도) 가중치
 * @param categoryCap 카테고리당 최대 노출 수 (0 이하이면 제한 없음)
 * @param coldThreshold 콜드 부스트 최소 cold_score
 * @param stockThreshold in_stock 사유 및 콜드 부스트 최소 재고
 * @param freshnessThreshold fresh 사유 최소 freshness_score
 */
public record ExposurePolicy(
    double popularityWeight,
    double strategicWeight,
    int categoryCap,
    double coldThreshold,
    int stockThreshold,
    double freshnessThreshold
) {
    static final double POPULAR_THRESHOLD = 0.5;

    public String popularReason() {
        return "popular_" + (int) (popularityWeight * 100);
    }

    public String coldBoostReason() {
        return "cold_boost_" + (int) (strategicWeight * 100);
    }
}
