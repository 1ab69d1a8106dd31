package com.rateview.interfaces.api.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.rateview.application.scoring.ScoringResult;
import com.rateview.domain.ranking.ProductRanking;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * 점수 계산 내부 API v1의 데이터 전송 객체(DTO) 컨테이너.
 *
 * @author Rateview
 * @version 1.0
 */
public class ScoringV1Dto {

    /**
     * 점수 계산 실행 응답.
     *
     * @param updated 랭킹이 갱신된 상품 ID
     * @param count 갱신 상품 수
     * @param windowDays 집계 구간(일)
     */
    public record RunResponse(
        @JsonProperty("updated") List<Long> updated,
        @JsonProperty("count") int count,
        @JsonProperty("window_days") int windowDays
    ) {
        public static RunResponse from(ScoringResult result) {
            return new RunResponse(result.updated(), result.count(), result.windowDays());
        }
    }

    /**
     * 랭킹 항목 응답.
     */
    public record RankingResponse(
        @JsonProperty("product_id") Long productId,
        @JsonProperty("popularity_score") double popularityScore,
        @JsonProperty("cold_score") double coldScore,
        @JsonProperty("profit_score") double profitScore,
        @JsonProperty("freshness_score") double freshnessScore,
        @JsonProperty("exposure_score") double exposureScore,
        @JsonProperty("computed_at") OffsetDateTime computedAt
    ) {
        public static RankingResponse from(ProductRanking ranking) {
            return new RankingResponse(
                ranking.getProductId(),
                ranking.getPopularityScore().doubleValue(),
                ranking.getColdScore().doubleValue(),
                ranking.getProfitScore().doubleValue(),
                ranking.getFreshnessScore().doubleValue(),
                ranking.getExposureScore().doubleValue(),
                ranking.getUpdatedAt() != null ? ranking.getUpdatedAt().toOffsetDateTime() : null
            );
        }
    }
}
