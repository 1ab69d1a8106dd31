package com.rateview.domain.promotion;

import java.util.Set;

/**
 * 카테고리 대상. 카테고리 목록이 비어 있으면 모든 카테고리에 적용합니다.
 */
public record CategoryPromotionTarget(Set<Long> categoryIds) implements PromotionTarget {

    public CategoryPromotionTarget {
        categoryIds = categoryIds == null ? Set.of() : Set.copyOf(categoryIds);
    }

    @Override
    public boolean appliesTo(Long productId, Long categoryId, String userId) {
        return categoryIds.isEmpty() || (categoryId != null && categoryIds.contains(categoryId));
    }
}
