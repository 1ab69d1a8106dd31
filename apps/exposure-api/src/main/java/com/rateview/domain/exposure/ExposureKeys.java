package com.rateview.domain.exposure;

/**
 * 노출 슬롯/캐시 키 규칙.
 * <ul>
 *   <li>슬롯 키: {@code context|categoryId} (카테고리가 없으면 {@code all})</li>
 *   <li>캐시 키: {@code context:userId:categoryId} (익명은 {@code anon}, 카테고리가 없으면 {@code all})</li>
 * </ul>
 * 요청 limit는 키에 포함하지 않습니다.
 */
public final class ExposureKeys {

    public static final String ANONYMOUS = "anon";
    private static final String ALL_CATEGORIES = "all";

    private ExposureKeys() {
    }

    public static String slotKey(String context, Long categoryId) {
        return context + "|" + categoryOrAll(categoryId);
    }

    public static String cacheKey(String context, String userId, Long categoryId) {
        return context + ":" + userKey(userId) + ":" + categoryOrAll(categoryId);
    }

    public static String userKey(String userId) {
        return userId == null ? ANONYMOUS : userId;
    }

    private static String categoryOrAll(Long categoryId) {
        return categoryId == null ? ALL_CATEGORIES : String.valueOf(categoryId);
    }
}
