package com.rateview.domain.promotion;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 후보 상품별 프로모션 조회 인덱스.
 * <p>
 * 해석 순서는 상품 대상 → 카테고리 대상 → 고객 대상입니다.
 * 같은 단계에서 여러 프로모션이 일치하면 id가 가장 작은 프로모션을 선택합니다.
 * </p>
 */
public class PromotionIndex {

    private static final PromotionIndex EMPTY = new PromotionIndex(List.of());

    private final Map<Long, ActivePromotion> byProduct = new HashMap<>();
    private final List<ActivePromotion> categoryPromotions;
    private final List<ActivePromotion> customerPromotions;

    public PromotionIndex(List<ActivePromotion> promotions) {
        List<ActivePromotion> ordered = promotions.stream()
            .sorted(Comparator.comparing(ActivePromotion::id))
            .toList();

        for (ActivePromotion promotion : ordered) {
            if (promotion.target() instanceof ProductPromotionTarget productTarget) {
                productTarget.productIds().forEach(productId -> byProduct.putIfAbsent(productId, promotion));
            }
        }
        this.categoryPromotions = ordered.stream()
            .filter(promotion -> promotion.target() instanceof CategoryPromotionTarget)
            .toList();
        this.customerPromotions = ordered.stream()
            .filter(promotion -> promotion.target() instanceof CustomerPromotionTarget)
            .toList();
    }

    public static PromotionIndex empty() {
        return EMPTY;
    }

    /**
     * 후보 상품에 적용할 프로모션을 찾습니다.
     *
     * @param productId 상품 ID
     * @param categoryId 상품 카테고리 ID
     * @param userId 요청 사용자 ID (익명이면 null)
     * @return 적용할 프로모션 (없으면 empty)
     */
    public Optional<ActivePromotion> resolve(Long productId, Long categoryId, String userId) {
        ActivePromotion productPromotion = byProduct.get(productId);
        if (productPromotion != null) {
            return Optional.of(productPromotion);
        }
        return firstMatch(categoryPromotions, productId, categoryId, userId)
            .or(() -> firstMatch(customerPromotions, productId, categoryId, userId));
    }

    private Optional<ActivePromotion> firstMatch(List<ActivePromotion> promotions, Long productId, Long categoryId, String userId) {
        return promotions.stream()
            .filter(promotion -> promotion.target().appliesTo(productId, categoryId, userId))
            .findFirst();
    }
}
