package com.rateview.domain.engagement;

import com.rateview.domain.BaseEntity;
import com.rateview.support.error.CoreException;
import com.rateview.support.error.ErrorType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 상품별 일별(UTC) 참여 집계 엔티티.
 * <p>
 * 한 상품의 하루치 조회/클릭/장바구니/구매 수와 매출을 저장합니다.
 * 카운터는 하루 안에서 증가만 하며 절대 감소하지 않습니다.
 * </p>
 *
 * @author Rateview
 * @version 1.0
 */
@Entity
@Table(
    name = "product_engagement_daily",
    uniqueConstraints = @UniqueConstraint(name = "uk_product_engagement_daily", columnNames = {"product_id", "stat_date"})
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
public class EngagementDaily extends BaseEntity {

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "stat_date", nullable = false)
    private LocalDate statDate;

    @Column(name = "views", nullable = false)
    private int views;

    @Column(name = "clicks", nullable = false)
    private int clicks;

    @Column(name = "carts", nullable = false)
    private int carts;

    @Column(name = "purchases", nullable = false)
    private int purchases;

    @Column(name = "revenue", nullable = false, precision = 14, scale = 2)
    private BigDecimal revenue;

    public EngagementDaily(Long productId, LocalDate statDate) {
        if (productId == null || statDate == null) {
            throw new CoreException(ErrorType.BAD_REQUEST, "상품 ID와 집계 일자는 필수입니다.");
        }
        this.productId = productId;
        this.statDate = statDate;
        this.revenue = BigDecimal.ZERO;
    }

    /**
     * 테스트 및 집계 복원을 위한 팩토리.
     */
    public static EngagementDaily of(Long productId, LocalDate statDate, int views, int clicks, int carts, int purchases, BigDecimal revenue) {
        EngagementDaily daily = new EngagementDaily(productId, statDate);
        daily.accumulate(new EngagementDelta(views, clicks, carts, purchases, revenue, 0));
        return daily;
    }

    /**
     * 증가분을 누적합니다.
     *
     * @param delta 증가분
     * @throws CoreException 음수 증가분인 경우 BAD_REQUEST
     */
    public void accumulate(EngagementDelta delta) {
        if (delta.hasNegative()) {
            throw new CoreException(ErrorType.BAD_REQUEST, "집계 카운터는 감소할 수 없습니다.");
        }
        this.views += delta.views();
        this.clicks += delta.clicks();
        this.carts += delta.carts();
        this.purchases += delta.purchases();
        this.revenue = this.revenue.add(delta.revenue());
    }
}
