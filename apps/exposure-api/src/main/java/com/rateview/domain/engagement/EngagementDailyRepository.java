package com.rateview.domain.engagement;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * 상품 일별 참여 집계 Repository 인터페이스.
 */
public interface EngagementDailyRepository {

    /**
     * 기준일 이후(포함)의 모든 집계 행을 조회합니다.
     *
     * @param fromDate 시작일
     * @return 집계 행 목록
     */
    List<EngagementDaily> findAllSince(LocalDate fromDate);

    /**
     * 상품/일자 집계 행을 조회합니다. (비관적 락)
     */
    Optional<EngagementDaily> findByProductIdAndDateForUpdate(Long productId, LocalDate statDate);

    /**
     * 상품의 집계 행을 조회합니다.
     *
     * @param productId 상품 ID
     * @param statDate 특정 일자 (null이면 전체)
     */
    List<EngagementDaily> findByProductId(Long productId, LocalDate statDate);

    EngagementDaily save(EngagementDaily engagementDaily);
}
