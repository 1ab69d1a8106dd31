package com.rateview.application.engagement;

import com.rateview.domain.engagement.CustomerEngagementDaily;
import com.rateview.domain.engagement.EngagementDaily;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 참여 집계 조회 결과.
 */
public final class EngagementInfo {

    private EngagementInfo() {
    }

    public record ProductDaily(
        Long productId,
        LocalDate date,
        int views,
        int clicks,
        int carts,
        int purchases,
        BigDecimal revenue
    ) {
        public static ProductDaily from(EngagementDaily daily) {
            return new ProductDaily(
                daily.getProductId(),
                daily.getStatDate(),
                daily.getViews(),
                daily.getClicks(),
                daily.getCarts(),
                daily.getPurchases(),
                daily.getRevenue()
            );
        }
    }

    public record CustomerDaily(
        String customerId,
        LocalDate date,
        int views,
        int clicks,
        int carts,
        int purchases,
        int pointsEarned
    ) {
        public static CustomerDaily from(CustomerEngagementDaily daily) {
            return new CustomerDaily(
                daily.getCustomerId(),
                daily.getStatDate(),
                daily.getViews(),
                daily.getClicks(),
                daily.getCarts(),
                daily.getPurchases(),
                daily.getPointsEarned()
            );
        }
    }

    /**
     * 이벤트 기록 결과.
     *
     * @param accepted 집계에 반영되었으면 true, 중복이면 false
     * @param productDaily 반영 후 상품 일별 집계 (중복이면 null)
     */
    public record Recorded(boolean accepted, ProductDaily productDaily) {

        public static Recorded duplicate() {
            return new Recorded(false, null);
        }
    }
}
