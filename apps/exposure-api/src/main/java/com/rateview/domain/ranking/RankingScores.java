package com.rateview.domain.ranking;

/**
 * 정규화된 상품 점수 묶음. 모든 값은 [0, 1], 소수 4자리.
 */
public record RankingScores(
    Long productId,
    double popularityScore,
    double coldScore,
    double profitScore,
    double freshnessScore,
    double exposureScore
) {
}
