package com.rateview.domain.promotion;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * PromotionIndex 테스트.
 */
class PromotionIndexTest {

    private static ActivePromotion category(long id, Set<Long> categoryIds) {
        return new ActivePromotion(id, PromotionType.CATEGORY, "global", new CategoryPromotionTarget(categoryIds));
    }

    private static ActivePromotion product(long id, Set<Long> productIds) {
        return new ActivePromotion(id, PromotionType.PRODUCT, "global", new ProductPromotionTarget(productIds));
    }

    private static ActivePromotion customer(long id, Set<String> customerIds) {
        return new ActivePromotion(id, PromotionType.CUSTOMER, "vip", new CustomerPromotionTarget(customerIds, new BigDecimal("100")));
    }

    @DisplayName("상품 대상 프로모션이 카테고리 대상보다 우선한다.")
    @Test
    void prefersProductPromotion() {
        // arrange
        PromotionIndex index = new PromotionIndex(List.of(category(1L, Set.of(10L)), product(2L, Set.of(100L))));

        // act
        Optional<ActivePromotion> resolved = index.resolve(100L, 10L, null);

        // assert
        assertThat(resolved).map(ActivePromotion::id).contains(2L);
    }

    @DisplayName("같은 단계에서 여러 프로모션이 일치하면 id가 가장 작은 것을 선택한다.")
    @Test
    void picksLowestId_whenSeveralMatch() {
        // arrange
        PromotionIndex index = new PromotionIndex(List.of(
            product(9L, Set.of(100L)),
            product(3L, Set.of(100L)),
            category(8L, Set.of(10L)),
            category(4L, Set.of(10L))
        ));

        // act & assert
        assertThat(index.resolve(100L, 10L, null)).map(ActivePromotion::id).contains(3L);
        assertThat(index.resolve(200L, 10L, null)).map(ActivePromotion::id).contains(4L);
    }

    @DisplayName("카테고리 목록이 빈 카테고리 프로모션은 모든 카테고리에 적용된다.")
    @Test
    void appliesEmptyCategoryPromotionEverywhere() {
        // arrange
        PromotionIndex index = new PromotionIndex(List.of(category(5L, Set.of())));

        // act & assert
        assertThat(index.resolve(1L, 99L, null)).map(ActivePromotion::id).contains(5L);
        assertThat(index.resolve(1L, null, null)).map(ActivePromotion::id).contains(5L);
    }

    @DisplayName("고객 대상 프로모션은 대상 사용자에게만 적용된다.")
    @Test
    void appliesCustomerPromotionToTargetUserOnly() {
        // arrange
        PromotionIndex index = new PromotionIndex(List.of(customer(6L, Set.of("vip-1"))));

        // act & assert
        assertThat(index.resolve(1L, 10L, "vip-1")).map(ActivePromotion::reason).contains("promo:6");
        assertThat(index.resolve(1L, 10L, "user-2")).isEmpty();
        assertThat(index.resolve(1L, 10L, null)).isEmpty();
    }

    @DisplayName("일치하는 프로모션이 없으면 빈 값을 반환한다.")
    @Test
    void returnsEmpty_whenNothingMatches() {
        // arrange
        PromotionIndex index = new PromotionIndex(List.of(category(1L, Set.of(10L)), product(2L, Set.of(100L))));

        // act & assert
        assertThat(index.resolve(200L, 20L, null)).isEmpty();
        assertThat(PromotionIndex.empty().resolve(100L, 10L, "user-1")).isEmpty();
    }
}
