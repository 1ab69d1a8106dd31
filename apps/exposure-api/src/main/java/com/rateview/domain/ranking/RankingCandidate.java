package com.rateview.domain.ranking;

/**
 * 노출 후보: 랭킹과 상품 카테고리를 함께 담습니다.
 *
 * @param ranking 상품 랭킹
 * @param categoryId 상품 카테고리 ID (없으면 null)
 */
public record RankingCandidate(
    ProductRanking ranking,
    Long categoryId
) {
    public Long productId() {
        return ranking.getProductId();
    }

    public double popularityScore() {
        return ranking.getPopularityScore().doubleValue();
    }

    public double coldScore() {
        return ranking.getColdScore().doubleValue();
    }

    public double freshnessScore() {
        return ranking.getFreshnessScore().doubleValue();
    }
}
