package com.rateview.cache;

import java.util.Optional;

/**
 * 공유 캐시 템플릿 인터페이스.
 * <p>
 * 여러 애플리케이션 인스턴스가 함께 사용하는 외부 캐시(Redis 등)에 대한 조회, 저장, 삭제를 제공합니다.
 * 구현체는 캐시 장애를 호출자에게 전파하지 않아야 합니다. 장애 시 조회는 빈 값을, 저장/삭제는 무시합니다.
 * </p>
 *
 * @author Rateview
 * @version 1.0
 */
public interface CacheTemplate {

    /**
     * 캐시에서 값을 조회합니다.
     *
     * @param cacheKey 캐시 키
     * @param <T> 캐시 값의 타입
     * @return 캐시 값 (없거나 조회 실패 시 Optional.empty())
     */
    <T> Optional<T> get(CacheKey<T> cacheKey);

    /**
     * 캐시에 값을 저장합니다. TTL은 캐시 키의 값을 따릅니다.
     *
     * @param cacheKey 캐시 키
     * @param value 저장할 값
     * @param <T> 캐시 값의 타입
     */
    <T> void put(CacheKey<T> cacheKey, T value);

    /**
     * 단일 키를 무효화합니다.
     *
     * @param cacheKey 캐시 키
     */
    void evict(CacheKey<?> cacheKey);

    /**
     * 주어진 접두사로 시작하는 모든 키를 무효화합니다.
     *
     * @param keyPrefix 키 접두사
     * @return 삭제된 키 개수 (실패 시 0)
     */
    long evictByPrefix(String keyPrefix);
}
