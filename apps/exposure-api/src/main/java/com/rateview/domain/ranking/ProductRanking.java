package com.rateview.domain.ranking;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.ZonedDateTime;

/**
 * 상품 노출 랭킹 엔티티.
 * <p>
 * 상품당 한 행을 유지하며 점수 계산 배치만 갱신합니다. 노출 구성 단계는 읽기만 합니다.
 * </p>
 * <p>
 * <b>불변식:</b> 다섯 점수는 항상 [0, 1] 범위이며 소수 4자리로 저장합니다.
 * </p>
 *
 * @author Rateview
 * @version 1.0
 */
@Entity
@Table(
    name = "product_ranking",
    indexes = @Index(name = "idx_product_ranking_exposure", columnList = "exposure_score, product_id")
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
public class ProductRanking {

    private static final int SCALE = 4;

    @Id
    @Column(name = "product_id")
    private Long productId;

    @Column(name = "popularity_score", nullable = false, precision = 5, scale = 4)
    private BigDecimal popularityScore;

    @Column(name = "cold_score", nullable = false, precision = 5, scale = 4)
    private BigDecimal coldScore;

    @Column(name = "profit_score", nullable = false, precision = 5, scale = 4)
    private BigDecimal profitScore;

    @Column(name = "freshness_score", nullable = false, precision = 5, scale = 4)
    private BigDecimal freshnessScore;

    @Column(name = "exposure_score", nullable = false, precision = 5, scale = 4)
    private BigDecimal exposureScore;

    @Column(name = "updated_at", nullable = false)
    private ZonedDateTime updatedAt;

    private ProductRanking(Long productId) {
        this.productId = productId;
    }

    public static ProductRanking of(RankingScores scores, ZonedDateTime updatedAt) {
        ProductRanking ranking = new ProductRanking(scores.productId());
        ranking.updateScores(scores, updatedAt);
        return ranking;
    }

    /**
     * 점수를 갱신합니다.
     *
     * @param scores 새 점수
     * @param updatedAt 갱신 시각
     */
    public void updateScores(RankingScores scores, ZonedDateTime updatedAt) {
        this.popularityScore = toScore(scores.popularityScore());
        this.coldScore = toScore(scores.coldScore());
        this.profitScore = toScore(scores.profitScore());
        this.freshnessScore = toScore(scores.freshnessScore());
        this.exposureScore = toScore(scores.exposureScore());
        this.updatedAt = updatedAt;
    }

    private static BigDecimal toScore(double value) {
        double clamped = Math.max(0.0, Math.min(1.0, value));
        return BigDecimal.valueOf(clamped).setScale(SCALE, RoundingMode.HALF_UP);
    }
}
