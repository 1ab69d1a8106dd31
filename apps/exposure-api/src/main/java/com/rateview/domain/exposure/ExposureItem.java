package com.rateview.domain.exposure;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 노출 구성에 포함된 상품 한 건.
 *
 * @param productId 상품 ID
 * @param reason 선택 사유 (순서 유지: popular_*, in_stock, cold_boost_*, fresh, promo:*)
 * @param badges 배지 (예: promo)
 */
public record ExposureItem(
    @JsonProperty("product_id") Long productId,
    @JsonProperty("reason") List<String> reason,
    @JsonProperty("badges") List<String> badges
) {
    public ExposureItem {
        reason = reason == null ? List.of() : List.copyOf(reason);
        badges = badges == null ? List.of() : List.copyOf(badges);
    }
}
