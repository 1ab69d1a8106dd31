package com.rateview.domain.engagement;

import com.rateview.support.error.CoreException;
import com.rateview.support.error.ErrorType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * EngagementEvent 테스트.
 */
class EngagementEventTest {

    private static final Instant OCCURRED_AT = Instant.parse("2024-12-15T23:45:10Z");

    private static EngagementEvent event(EngagementEventType type, String userId, String sessionId, Instant occurredAt) {
        return new EngagementEvent(type, 1L, userId, sessionId, occurredAt, null, null);
    }

    @DisplayName("중복 제거 키")
    @Nested
    class DedupKey {

        @DisplayName("사용자, 상품, 시간 버킷 시작, 유형으로 구성된다.")
        @Test
        void composesKeyFromUserProductBucketAndType() {
            // arrange
            EngagementEvent event = event(EngagementEventType.VIEW, "user-1", "session-1", OCCURRED_AT);

            // act
            String key = event.dedupKey();

            // assert
            assertThat(key).isEqualTo("user-1:1:2024-12-15T23:00:00Z:view");
        }

        @DisplayName("사용자가 없으면 세션, 둘 다 없으면 anon을 사용한다.")
        @Test
        void fallsBackToSessionThenAnon() {
            // act & assert
            assertThat(event(EngagementEventType.CLICK, null, "session-1", OCCURRED_AT).dedupKey())
                .startsWith("session-1:");
            assertThat(event(EngagementEventType.CLICK, null, null, OCCURRED_AT).dedupKey())
                .startsWith("anon:");
        }

        @DisplayName("같은 시간 버킷 안의 같은 이벤트는 같은 키를 가진다.")
        @Test
        void sharesKeyWithinSameHour() {
            // arrange
            EngagementEvent first = event(EngagementEventType.VIEW, "user-1", null, Instant.parse("2024-12-15T10:00:01Z"));
            EngagementEvent second = event(EngagementEventType.VIEW, "user-1", null, Instant.parse("2024-12-15T10:59:59Z"));
            EngagementEvent nextHour = event(EngagementEventType.VIEW, "user-1", null, Instant.parse("2024-12-15T11:00:00Z"));

            // act & assert
            assertThat(first.dedupKey()).isEqualTo(second.dedupKey());
            assertThat(first.dedupKey()).isNotEqualTo(nextHour.dedupKey());
        }
    }

    @DisplayName("집계 증가분")
    @Nested
    class Delta {

        @DisplayName("구매는 수량만큼 증가하고 매출은 단가 × 수량, 고객 포인트는 수량 × 10이다.")
        @Test
        void computesPurchaseDelta() {
            // arrange
            EngagementEvent event = new EngagementEvent(
                EngagementEventType.PURCHASE, 1L, "user-1", null, OCCURRED_AT, new BigDecimal("12.50"), 3);

            // act
            EngagementDelta productDelta = event.productDelta();
            EngagementDelta customerDelta = event.customerDelta();

            // assert
            assertThat(productDelta.purchases()).isEqualTo(3);
            assertThat(productDelta.revenue()).isEqualByComparingTo("37.50");
            assertThat(customerDelta.purchases()).isEqualTo(3);
            assertThat(customerDelta.points()).isEqualTo(30);
            assertThat(customerDelta.revenue()).isEqualByComparingTo(BigDecimal.ZERO);
        }

        @DisplayName("수량이 없거나 0이면 1로 간주한다.")
        @Test
        void defaultsQuantityToOne() {
            // arrange
            EngagementEvent missing = new EngagementEvent(EngagementEventType.ADD_TO_CART, 1L, null, null, OCCURRED_AT, null, null);
            EngagementEvent zero = new EngagementEvent(EngagementEventType.ADD_TO_CART, 1L, null, null, OCCURRED_AT, null, 0);

            // act & assert
            assertThat(missing.productDelta().carts()).isEqualTo(1);
            assertThat(zero.productDelta().carts()).isEqualTo(1);
        }

        @DisplayName("단가가 없는 구매는 매출 0으로 집계한다.")
        @Test
        void recordsZeroRevenue_whenPriceMissing() {
            // arrange
            EngagementEvent event = new EngagementEvent(EngagementEventType.PURCHASE, 1L, null, null, OCCURRED_AT, null, 2);

            // act
            EngagementDelta delta = event.productDelta();

            // assert
            assertThat(delta.purchases()).isEqualTo(2);
            assertThat(delta.revenue()).isEqualByComparingTo(BigDecimal.ZERO);
        }
    }

    @DisplayName("집계 일자는 이벤트 시각의 UTC 날짜다.")
    @Test
    void usesUtcDate() {
        // arrange
        EngagementEvent event = event(EngagementEventType.VIEW, null, null, OCCURRED_AT);

        // act
        LocalDate statDate = event.statDate();

        // assert
        assertThat(statDate).isEqualTo(LocalDate.of(2024, 12, 15));
    }

    @DisplayName("음수 수량이나 가격이면 BAD_REQUEST 예외가 발생한다.")
    @Test
    void rejectsNegativeQuantityOrPrice() {
        // act & assert
        assertThatThrownBy(() -> new EngagementEvent(EngagementEventType.PURCHASE, 1L, null, null, OCCURRED_AT, null, -1))
            .isInstanceOf(CoreException.class)
            .extracting("errorType").isEqualTo(ErrorType.BAD_REQUEST);
        assertThatThrownBy(() -> new EngagementEvent(EngagementEventType.PURCHASE, 1L, null, null, OCCURRED_AT, new BigDecimal("-1"), 1))
            .isInstanceOf(CoreException.class)
            .extracting("errorType").isEqualTo(ErrorType.BAD_REQUEST);
    }

    @DisplayName("알 수 없는 이벤트 유형 코드는 BAD_REQUEST 예외가 발생한다.")
    @Test
    void rejectsUnknownEventType() {
        // act & assert
        assertThat(EngagementEventType.from("add_to_cart")).isEqualTo(EngagementEventType.ADD_TO_CART);
        assertThatThrownBy(() -> EngagementEventType.from("wishlist"))
            .isInstanceOf(CoreException.class)
            .extracting("errorType").isEqualTo(ErrorType.BAD_REQUEST);
    }
}
