package com.rateview.domain.promotion;

import java.math.BigDecimal;
import java.util.Set;

/**
 * 고객 대상.
 * <p>
 * 노출 시점에는 주문 금액을 알 수 없으므로 {@code minOrderTotal}은 결제 단계에서만 평가하며,
 * 여기서는 요청 사용자가 대상 고객인지만 확인합니다.
 * </p>
 *
 * @param customerIds 대상 고객 ID
 * @param minOrderTotal 최소 주문 금액 (없으면 null)
 */
public record CustomerPromotionTarget(Set<String> customerIds, BigDecimal minOrderTotal) implements PromotionTarget {

    public CustomerPromotionTarget {
        customerIds = customerIds == null ? Set.of() : Set.copyOf(customerIds);
    }

    @Override
    public boolean appliesTo(Long productId, Long categoryId, String userId) {
        return userId != null && customerIds.contains(userId);
    }
}
