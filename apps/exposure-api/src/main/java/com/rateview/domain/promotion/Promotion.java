package com.rateview.domain.promotion;

import com.rateview.domain.BaseEntity;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;
import java.util.HashSet;
import java.util.Set;

/**
 * 프로모션 읽기 모델.
 * <p>
 * 프로모션 생성/수정은 프로모션 관리 모듈의 책임입니다.
 * 이 엔진은 활성 프로모션을 읽어 노출 항목에 배지와 사유를 덧붙이는 데만 사용합니다.
 * </p>
 * <p>
 * {@code criteriaJson}은 유형별 조건(예: {@code {"category_ids": [1, 2]}})을 담으며,
 * 조회 시점에 타입이 있는 {@link PromotionTarget}으로 변환합니다.
 * </p>
 *
 * @author Rateview
 * @version 1.0
 */
@Entity
@Table(
    name = "promotion",
    indexes = {
        @Index(name = "idx_promotion_status", columnList = "status"),
        @Index(name = "idx_promotion_start_end", columnList = "start_at, end_at")
    }
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
public class Promotion extends BaseEntity {

    @Column(name = "name", nullable = false, length = 180)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 20)
    private PromotionType type;

    @Column(name = "scope", nullable = false, length = 80)
    private String scope;

    @Column(name = "criteria_json", columnDefinition = "TEXT")
    private String criteriaJson;

    @Column(name = "benefits_json", columnDefinition = "TEXT")
    private String benefitsJson;

    @Column(name = "start_at", nullable = false)
    private ZonedDateTime startAt;

    @Column(name = "end_at", nullable = false)
    private ZonedDateTime endAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PromotionStatus status;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "promotion_product", joinColumns = @JoinColumn(name = "promotion_id"))
    @Column(name = "product_id", nullable = false)
    private Set<Long> productIds = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "promotion_customer", joinColumns = @JoinColumn(name = "promotion_id"))
    @Column(name = "customer_id", nullable = false, length = 64)
    private Set<String> customerIds = new HashSet<>();

    public Promotion(
        String name,
        PromotionType type,
        String scope,
        String criteriaJson,
        String benefitsJson,
        ZonedDateTime startAt,
        ZonedDateTime endAt,
        PromotionStatus status,
        Set<Long> productIds,
        Set<String> customerIds
    ) {
        this.name = name;
        this.type = type;
        this.scope = scope == null ? "global" : scope;
        this.criteriaJson = criteriaJson;
        this.benefitsJson = benefitsJson;
        this.startAt = startAt;
        this.endAt = endAt;
        this.status = status;
        this.productIds = productIds == null ? new HashSet<>() : new HashSet<>(productIds);
        this.customerIds = customerIds == null ? new HashSet<>() : new HashSet<>(customerIds);
    }

    /**
     * 주어진 시각에 노출 가능한(ACTIVE이며 기간 내) 프로모션인지 확인합니다.
     */
    public boolean isActiveAt(ZonedDateTime now) {
        return status == PromotionStatus.ACTIVE
            && !now.isBefore(startAt)
            && !now.isAfter(endAt);
    }
}
