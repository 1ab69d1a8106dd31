package com.rateview.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Redis 캐시 템플릿 구현체.
 * <p>
 * 값을 JSON 문자열로 직렬화하여 저장합니다. Redis 장애는 WARN 로그만 남기고 삼킵니다.
 * </p>
 *
 * @author Rateview
 * @version 1.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisCacheTemplate implements CacheTemplate {

    private static final long SCAN_BATCH_SIZE = 500L;

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public <T> Optional<T> get(CacheKey<T> cacheKey) {
        try {
            String json = redisTemplate.opsForValue().get(cacheKey.key());
            if (json == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(deserialize(cacheKey.key(), json, cacheKey.type()));
        } catch (Exception e) {
            log.warn("캐시 조회 실패. (key: {})", cacheKey.key(), e);
            return Optional.empty();
        }
    }

    @Override
    public <T> void put(CacheKey<T> cacheKey, T value) {
        try {
            redisTemplate.opsForValue().set(cacheKey.key(), serialize(cacheKey.key(), value), cacheKey.ttl());
        } catch (Exception e) {
            log.warn("캐시 저장 실패. (key: {})", cacheKey.key(), e);
        }
    }

    @Override
    public void evict(CacheKey<?> cacheKey) {
        try {
            redisTemplate.delete(cacheKey.key());
        } catch (Exception e) {
            log.warn("캐시 삭제 실패. (key: {})", cacheKey.key(), e);
        }
    }

    @Override
    public long evictByPrefix(String keyPrefix) {
        ScanOptions options = ScanOptions.scanOptions()
            .match(keyPrefix + "*")
            .count(SCAN_BATCH_SIZE)
            .build();
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            List<String> keys = new ArrayList<>();
            cursor.forEachRemaining(keys::add);
            if (keys.isEmpty()) {
                return 0L;
            }
            Long deleted = redisTemplate.delete(keys);
            return deleted != null ? deleted : 0L;
        } catch (Exception e) {
            log.warn("캐시 접두사 삭제 실패. (prefix: {})", keyPrefix, e);
            return 0L;
        }
    }

    private String serialize(String key, Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CacheSerializationException(key, "캐시 직렬화 실패", e);
        }
    }

    private <T> T deserialize(String key, String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new CacheSerializationException(key, "캐시 역직렬화 실패", e);
        }
    }
}
