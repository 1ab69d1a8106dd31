package com.rateview.domain.promotion;

/**
 * 조건이 검증된 활성 프로모션.
 *
 * @param id 프로모션 ID
 * @param type 유형
 * @param scope 범위 표기
 * @param target 적용 대상
 */
public record ActivePromotion(
    Long id,
    PromotionType type,
    String scope,
    PromotionTarget target
) {
    public String reason() {
        return "promo:" + id;
    }
}
