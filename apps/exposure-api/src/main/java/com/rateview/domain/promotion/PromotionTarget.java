package com.rateview.domain.promotion;

/**
 * 프로모션 적용 대상.
 * <p>
 * 프로모션 유형마다 구현이 하나씩 있으며, 자유 형식 조건 JSON 대신 타입이 있는 필드로 조건을 표현합니다.
 * </p>
 *
 * @see CategoryPromotionTarget
 * @see ProductPromotionTarget
 * @see CustomerPromotionTarget
 */
public interface PromotionTarget {

    /**
     * @param productId 상품 ID
     * @param categoryId 상품 카테고리 ID (없으면 null)
     * @param userId 요청 사용자 ID (익명이면 null)
     * @return 대상에 해당하면 true
     */
    boolean appliesTo(Long productId, Long categoryId, String userId);
}
