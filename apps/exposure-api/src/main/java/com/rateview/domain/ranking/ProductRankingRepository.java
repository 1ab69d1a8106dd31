package com.rateview.domain.ranking;

import java.util.List;
import java.util.Optional;

/**
 * ProductRanking Repository 인터페이스.
 */
public interface ProductRankingRepository {

    Optional<ProductRanking> findByProductId(Long productId);

    ProductRanking save(ProductRanking productRanking);

    /**
     * exposure_score 내림차순, product_id 오름차순으로 상위 N개를 조회합니다.
     */
    List<ProductRanking> findTopByExposureScore(int limit);

    /**
     * 상품 카테고리와 함께 상위 후보를 조회합니다.
     *
     * @param categoryId 카테고리 필터 (null이면 전체)
     * @param limit 최대 후보 수
     * @return exposure_score 내림차순, product_id 오름차순 후보 목록
     */
    List<RankingCandidate> findTopCandidates(Long categoryId, int limit);
}
