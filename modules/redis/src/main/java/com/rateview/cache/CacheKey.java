package com.rateview.cache;

import java.time.Duration;

/**
 * 캐시 키 인터페이스.
 * <p>
 * 키 문자열, TTL, 역직렬화 대상 타입을 함께 묶어 전달합니다.
 * </p>
 *
 * @param <T> 캐시 값의 타입
 * @author Rateview
 * @version 1.0
 */
public interface CacheKey<T> {

    /**
     * @return 캐시 키 문자열
     */
    String key();

    /**
     * @return 캐시 TTL
     */
    Duration ttl();

    /**
     * 캐시 값의 타입을 반환합니다. 역직렬화 시 사용됩니다.
     *
     * @return 타입
     */
    Class<T> type();
}
