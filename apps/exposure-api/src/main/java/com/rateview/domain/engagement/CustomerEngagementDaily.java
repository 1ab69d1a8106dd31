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

import java.time.LocalDate;

/**
 * 고객별 일별(UTC) 참여 집계 엔티티.
 * <p>
 * 점수 계산에는 사용하지 않으며, 다른 엔진(로열티 등)이 참고하는 용도입니다.
 * </p>
 */
@Entity
@Table(
    name = "customer_engagement_daily",
    uniqueConstraints = @UniqueConstraint(name = "uk_customer_engagement_daily", columnNames = {"customer_id", "stat_date"})
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
public class CustomerEngagementDaily extends BaseEntity {

    @Column(name = "customer_id", nullable = false, length = 64)
    private String customerId;

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

    @Column(name = "points_earned", nullable = false)
    private int pointsEarned;

    public CustomerEngagementDaily(String customerId, LocalDate statDate) {
        if (customerId == null || customerId.isBlank() || statDate == null) {
            throw new CoreException(ErrorType.BAD_REQUEST, "고객 ID와 집계 일자는 필수입니다.");
        }
        this.customerId = customerId;
        this.statDate = statDate;
    }

    public void accumulate(EngagementDelta delta) {
        if (delta.hasNegative()) {
            throw new CoreException(ErrorType.BAD_REQUEST, "집계 카운터는 감소할 수 없습니다.");
        }
        this.views += delta.views();
        this.clicks += delta.clicks();
        this.carts += delta.carts();
        this.purchases += delta.purchases();
        this.pointsEarned += delta.points();
    }
}
