package com.rateview.domain.ranking;

import com.rateview.domain.catalog.FinancialMetrics;

/**
 * 정규화 전 원시 신호.
 *
 * @param productId 상품 ID
 * @param popularityRaw 0.2*views + 0.3*clicks + 0.5*carts + 1.2*purchases
 * @param profitRaw margin * conversion
 * @param coldRaw 역인기도 비율 + 재고/50
 * @param freshness 최근 활동 감쇠 계수
 */
public record RawSignals(
    Long productId,
    double popularityRaw,
    double profitRaw,
    double coldRaw,
    double freshness
) {
    private static final double VIEW_WEIGHT = 0.2;
    private static final double CLICK_WEIGHT = 0.3;
    private static final double CART_WEIGHT = 0.5;
    private static final double PURCHASE_WEIGHT = 1.2;
    private static final double EPSILON = 1e-6;
    // 재고 항은 조회 비율 항과 단위가 다르며 50은 경험적 스케일 상수
    private static final double STOCK_SCALE = 50.0;

    public static RawSignals of(DecayedEngagement engagement, FinancialMetrics financialMetrics) {
        double views = engagement.getViews();
        double popularity = Math.max(0.0,
            VIEW_WEIGHT * views
                + CLICK_WEIGHT * engagement.getClicks()
                + CART_WEIGHT * engagement.getCarts()
                + PURCHASE_WEIGHT * engagement.getPurchases());

        double conversion = engagement.getPurchases() / Math.max(views, 1.0);
        double profit = Math.max(0.0, financialMetrics.margin().doubleValue() * conversion);

        double inversePopularity = 1.0 - Math.min(1.0, popularity / (views + EPSILON));
        double cold = Math.max(0.0, inversePopularity + financialMetrics.stockOnHand() / STOCK_SCALE);

        return new RawSignals(engagement.getProductId(), popularity, profit, cold, engagement.getFreshness());
    }
}
