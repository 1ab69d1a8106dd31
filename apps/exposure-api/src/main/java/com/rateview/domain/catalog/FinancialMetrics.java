package com.rateview.domain.catalog;

import java.math.BigDecimal;

/**
 * 상품 재무 지표.
 * <p>
 * 카탈로그/재고 모듈이 제공하는 값으로, 점수 계산(마진)과 노출 구성(재고)에 사용합니다.
 * 조회에 실패한 경우 {@link #empty()}로 대체합니다.
 * </p>
 *
 * @param margin 단위 마진
 * @param stockOnHand 가용 재고
 * @param categoryId 카테고리 ID (알 수 없으면 null)
 */
public record FinancialMetrics(
    BigDecimal margin,
    int stockOnHand,
    Long categoryId
) {
    public FinancialMetrics {
        margin = margin == null ? BigDecimal.ZERO : margin;
        stockOnHand = Math.max(0, stockOnHand);
    }

    public static FinancialMetrics empty() {
        return new FinancialMetrics(BigDecimal.ZERO, 0, null);
    }
}
