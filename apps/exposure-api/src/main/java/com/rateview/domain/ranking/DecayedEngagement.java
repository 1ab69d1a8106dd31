package com.rateview.domain.ranking;

import com.rateview.domain.engagement.EngagementDaily;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * 상품 한 건의 감쇠 누적 참여 지표.
 * <p>
 * 집계 구간 내 일별 행을 더할 때마다 나이(age)에 따른 감쇠 계수를 곱해 누적합니다.
 * 신선도는 합이 아니라 가장 최근 활동의 감쇠 계수(최댓값)입니다.
 * </p>
 */
@Getter
public class DecayedEngagement {

    private final Long productId;
    private double views;
    private double clicks;
    private double carts;
    private double purchases;
    private BigDecimal revenue = BigDecimal.ZERO;
    private double freshness;
    private double latestAgeDays = Double.POSITIVE_INFINITY;

    public DecayedEngagement(Long productId) {
        this.productId = productId;
    }

    /**
     * 일별 집계 행 하나를 누적합니다.
     *
     * @param row 일별 집계 행
     * @param ageDays 오늘 기준 경과 일수
     * @param decay 참여 지표 감쇠
     * @param freshnessDecay 신선도 감쇠
     */
    public void accumulate(EngagementDaily row, double ageDays, HalfLifeDecay decay, HalfLifeDecay freshnessDecay) {
        double factor = decay.factor(ageDays);
        this.views += row.getViews() * factor;
        this.clicks += row.getClicks() * factor;
        this.carts += row.getCarts() * factor;
        this.purchases += row.getPurchases() * factor;
        this.revenue = this.revenue.add(row.getRevenue().multiply(BigDecimal.valueOf(factor)));
        this.freshness = Math.max(this.freshness, freshnessDecay.factor(ageDays));
        this.latestAgeDays = Math.min(this.latestAgeDays, ageDays);
    }
}
