package com.rateview.domain.promotion;

import java.util.Set;

/**
 * 상품 대상.
 */
public record ProductPromotionTarget(Set<Long> productIds) implements PromotionTarget {

    public ProductPromotionTarget {
        productIds = productIds == null ? Set.of() : Set.copyOf(productIds);
    }

    @Override
    public boolean appliesTo(Long productId, Long categoryId, String userId) {
        return productId != null && productIds.contains(productId);
    }
}
