package com.rateview.domain.engagement;

import com.rateview.support.error.CoreException;
import com.rateview.support.error.ErrorType;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * 단일 참여 이벤트.
 * <p>
 * 프런트엔드 트래커 또는 결제 백엔드가 보낸 이벤트를 표현합니다.
 * 같은 사용자/세션의 같은 상품, 같은 시간 버킷, 같은 유형 이벤트는 중복으로 간주합니다.
 * </p>
 *
 * @param eventType 이벤트 유형
 * @param productId 상품 ID
 * @param userId 사용자 ID (익명이면 null)
 * @param sessionId 세션 ID (선택)
 * @param occurredAt 발생 시각
 * @param price 단가 (구매 이벤트의 매출 계산용, 선택)
 * @param quantity 수량 (장바구니/구매, 없으면 1)
 */
public record EngagementEvent(
    EngagementEventType eventType,
    Long productId,
    String userId,
    String sessionId,
    Instant occurredAt,
    BigDecimal price,
    Integer quantity
) {
    private static final int POINTS_PER_UNIT = 10;

    public EngagementEvent {
        if (eventType == null) {
            throw new CoreException(ErrorType.BAD_REQUEST, "이벤트 유형은 필수입니다.");
        }
        if (productId == null) {
            throw new CoreException(ErrorType.BAD_REQUEST, "상품 ID는 필수입니다.");
        }
        if (occurredAt == null) {
            throw new CoreException(ErrorType.BAD_REQUEST, "이벤트 발생 시각은 필수입니다.");
        }
        if (price != null && price.signum() < 0) {
            throw new CoreException(ErrorType.BAD_REQUEST, "가격은 0 이상이어야 합니다.");
        }
        if (quantity != null && quantity < 0) {
            throw new CoreException(ErrorType.BAD_REQUEST, "수량은 0 이상이어야 합니다.");
        }
    }

    public Instant bucketStart() {
        return occurredAt.truncatedTo(ChronoUnit.HOURS);
    }

    public LocalDate statDate() {
        return LocalDate.ofInstant(occurredAt, ZoneOffset.UTC);
    }

    /**
     * 중복 제거 키: {@code 사용자|세션|anon : 상품 : 버킷 시작 : 유형}.
     */
    public String dedupKey() {
        String actor = userId != null ? userId : (sessionId != null ? sessionId : "anon");
        return actor + ":" + productId + ":" + bucketStart() + ":" + eventType.getCode();
    }

    public int quantityOrDefault() {
        return quantity == null || quantity == 0 ? 1 : quantity;
    }

    /**
     * 상품 일별 집계 증가분.
     */
    public EngagementDelta productDelta() {
        int qty = quantityOrDefault();
        return switch (eventType) {
            case VIEW -> new EngagementDelta(1, 0, 0, 0, BigDecimal.ZERO, 0);
            case CLICK -> new EngagementDelta(0, 1, 0, 0, BigDecimal.ZERO, 0);
            case ADD_TO_CART -> new EngagementDelta(0, 0, qty, 0, BigDecimal.ZERO, 0);
            case PURCHASE -> new EngagementDelta(0, 0, 0, qty,
                price == null ? BigDecimal.ZERO : price.multiply(BigDecimal.valueOf(qty)), 0);
        };
    }

    /**
     * 고객 일별 집계 증가분. 구매 시 수량당 10 포인트를 적립합니다.
     */
    public EngagementDelta customerDelta() {
        int qty = quantityOrDefault();
        return switch (eventType) {
            case VIEW -> new EngagementDelta(1, 0, 0, 0, BigDecimal.ZERO, 0);
            case CLICK -> new EngagementDelta(0, 1, 0, 0, BigDecimal.ZERO, 0);
            case ADD_TO_CART -> new EngagementDelta(0, 0, qty, 0, BigDecimal.ZERO, 0);
            case PURCHASE -> new EngagementDelta(0, 0, 0, qty, BigDecimal.ZERO, qty * POINTS_PER_UNIT);
        };
    }
}
