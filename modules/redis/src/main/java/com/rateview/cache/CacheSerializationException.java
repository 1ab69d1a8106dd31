package com.rateview.cache;

import lombok.Getter;

/**
 * 캐시 값의 JSON 변환 실패.
 * <p>
 * {@link RedisCacheTemplate} 안에서만 던져지며, 호출자에게는 캐시 미스로 흡수됩니다.
 * </p>
 */
@Getter
public class CacheSerializationException extends RuntimeException {

    private final String key;

    public CacheSerializationException(String key, String message, Throwable cause) {
        super(String.format("%s (key: %s)", message, key), cause);
        this.key = key;
    }
}
