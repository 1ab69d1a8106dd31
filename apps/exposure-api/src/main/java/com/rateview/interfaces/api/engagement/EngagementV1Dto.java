package com.rateview.interfaces.api.engagement;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.rateview.application.engagement.EngagementInfo;
import com.rateview.domain.engagement.EngagementEvent;
import com.rateview.domain.engagement.EngagementEventType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * 참여 이벤트 API v1의 데이터 전송 객체(DTO) 컨테이너.
 *
 * @author Rateview
 * @version 1.0
 */
public class EngagementV1Dto {

    /**
     * 이벤트 수집 요청.
     *
     * @param eventType 이벤트 유형 (view, click, add_to_cart, purchase)
     * @param productId 상품 ID
     * @param userId 사용자 ID (선택)
     * @param sessionId 세션 ID (선택)
     * @param timestamp 발생 시각 (선택, 없으면 수신 시각)
     * @param price 단가 (선택, 0 이상)
     * @param metadata 부가 정보 (수량)
     */
    public record EventRequest(
        @JsonProperty("event_type")
        @NotBlank
        @Pattern(regexp = "^(view|click|add_to_cart|purchase)$", message = "은(는) view, click, add_to_cart, purchase 중 하나여야 합니다.")
        String eventType,
        @JsonProperty("product_id") @NotNull Long productId,
        @JsonProperty("user_id") String userId,
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("timestamp") OffsetDateTime timestamp,
        @JsonProperty("price") @DecimalMin("0") BigDecimal price,
        @JsonProperty("metadata") @Valid Metadata metadata
    ) {
        public EngagementEvent toEvent(Instant receivedAt) {
            return new EngagementEvent(
                EngagementEventType.from(eventType),
                productId,
                blankToNull(userId),
                blankToNull(sessionId),
                timestamp != null ? timestamp.toInstant() : receivedAt,
                price,
                metadata != null ? metadata.quantity() : null
            );
        }

        private static String blankToNull(String value) {
            return value == null || value.isBlank() ? null : value;
        }
    }

    public record Metadata(
        @JsonProperty("quantity") @Min(0) Integer quantity
    ) {
    }

    /**
     * 이벤트 수집 응답. 중복 이벤트면 accepted=false이고 카운터는 0입니다.
     */
    public record EventResponse(
        @JsonProperty("accepted") boolean accepted,
        @JsonProperty("product_id") Long productId,
        @JsonProperty("date") LocalDate date,
        @JsonProperty("views") int views,
        @JsonProperty("clicks") int clicks,
        @JsonProperty("carts") int carts,
        @JsonProperty("purchases") int purchases,
        @JsonProperty("revenue") BigDecimal revenue
    ) {
        public static EventResponse from(EngagementInfo.Recorded recorded, EngagementEvent event) {
            if (!recorded.accepted()) {
                return new EventResponse(false, event.productId(), event.statDate(), 0, 0, 0, 0, BigDecimal.ZERO);
            }
            EngagementInfo.ProductDaily daily = recorded.productDaily();
            return new EventResponse(true, daily.productId(), daily.date(), daily.views(), daily.clicks(),
                daily.carts(), daily.purchases(), daily.revenue());
        }
    }

    public record ProductEngagementResponse(
        @JsonProperty("product_id") Long productId,
        @JsonProperty("date") LocalDate date,
        @JsonProperty("views") int views,
        @JsonProperty("clicks") int clicks,
        @JsonProperty("carts") int carts,
        @JsonProperty("purchases") int purchases,
        @JsonProperty("revenue") BigDecimal revenue
    ) {
        public static ProductEngagementResponse from(EngagementInfo.ProductDaily daily) {
            return new ProductEngagementResponse(daily.productId(), daily.date(), daily.views(), daily.clicks(),
                daily.carts(), daily.purchases(), daily.revenue());
        }
    }

    public record CustomerEngagementResponse(
        @JsonProperty("customer_id") String customerId,
        @JsonProperty("date") LocalDate date,
        @JsonProperty("views") int views,
        @JsonProperty("clicks") int clicks,
        @JsonProperty("carts") int carts,
        @JsonProperty("purchases") int purchases,
        @JsonProperty("points_earned") int pointsEarned
    ) {
        public static CustomerEngagementResponse from(EngagementInfo.CustomerDaily daily) {
            return new CustomerEngagementResponse(daily.customerId(), daily.date(), daily.views(), daily.clicks(),
                daily.carts(), daily.purchases(), daily.pointsEarned());
        }
    }
}
