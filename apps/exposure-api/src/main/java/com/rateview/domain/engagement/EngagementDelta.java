package com.rateview.domain.engagement;

import java.math.BigDecimal;

/**
 * 일별 집계에 더할 증가분.
 *
 * @param views 조회 수
 * @param clicks 클릭 수
 * @param carts 장바구니 담기 수량
 * @param purchases 구매 수량
 * @param revenue 매출
 * @param points 적립 포인트 (고객 집계 전용)
 */
public record EngagementDelta(
    int views,
    int clicks,
    int carts,
    int purchases,
    BigDecimal revenue,
    int points
) {
    public EngagementDelta {
        revenue = revenue == null ? BigDecimal.ZERO : revenue;
    }

    public boolean hasNegative() {
        return views < 0 || clicks < 0 || carts < 0 || purchases < 0 || points < 0
            || revenue.signum() < 0;
    }
}
