package com.rateview.application.exposure;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.rateview.domain.exposure.ExposureItem;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 노출 구성 결과.
 * <p>
 * 클라이언트 응답, 노출 슬롯 payload, 캐시 값이 모두 이 형태를 공유합니다.
 * 프런트엔드 호환을 위해 필드명은 snake_case로 고정합니다.
 * </p>
 *
 * @param context 노출 컨텍스트 (home, category, carousel 등)
 * @param userId 사용자 ID (익명이면 null)
 * @param categoryId 카테고리 필터 (없으면 null)
 * @param generatedAt 생성 시각 (UTC)
 * @param expiresAt 만료 시각 (UTC)
 * @param mix 노출 항목
 */
public record ExposureResponse(
    @JsonProperty("context") String context,
    @JsonProperty("user_id") String userId,
    @JsonProperty("category_id") Long categoryId,
    @JsonProperty("generated_at") OffsetDateTime generatedAt,
    @JsonProperty("expires_at") OffsetDateTime expiresAt,
    @JsonProperty("mix") List<ExposureItem> mix
) {
    public ExposureResponse {
        mix = mix == null ? List.of() : List.copyOf(mix);
    }

    public Set<Long> productIds() {
        return mix.stream()
            .map(ExposureItem::productId)
            .collect(Collectors.toSet());
    }
}
