package com.rateview.cache;

import java.time.Duration;

/**
 * 기본 캐시 키 구현체.
 *
 * @param <T> 캐시 값의 타입
 * @author Rateview
 * @version 1.0
 */
public record SimpleCacheKey<T>(
    String key,
    Duration ttl,
    Class<T> type
) implements CacheKey<T> {

    public static <T> SimpleCacheKey<T> of(String key, Duration ttl, Class<T> type) {
        return new SimpleCacheKey<>(key, ttl, type);
    }
}
