package com.rateview.application.exposure;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.rateview.application.metrics.EngineMetrics;
import com.rateview.cache.CacheTemplate;
import com.rateview.cache.SimpleCacheKey;
import com.rateview.config.ExposureProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 노출 결과 2단 캐시.
 * <p>
 * <b>로컬 계층:</b> Caffeine 캐시에 (저장 시각, 만료 시각, payload)를 보관합니다.
 * 저장 후 TTL이 지났거나 만료 시각을 넘은 엔트리는 미스로 처리하고, 같은 엔트리일 때만 제거합니다.
 * 만료 판정은 주입된 {@link Clock}을 기준으로 합니다.
 * </p>
 * <p>
 * <b>공유 계층:</b> Redis({@code exposure:<key>})에 같은 값을 저장해 인스턴스 간에 공유합니다.
 * 조회는 공유 계층을 먼저 보고 로컬 계층으로 내려갑니다. 공유 계층 장애는 사용자에게 드러나지 않습니다.
 * </p>
 *
 * @author Rateview
 * @version 1.0
 */
@Slf4j
@Component
public class ExposureCache {

    static final String KEY_PREFIX = "exposure:";

    private final Cache<String, LocalEntry> localCache;
    private final CacheTemplate cacheTemplate;
    private final EngineMetrics engineMetrics;
    private final Clock clock;
    private final Duration ttl;
    private final boolean externalEnabled;

    public ExposureCache(
        CacheTemplate cacheTemplate,
        EngineMetrics engineMetrics,
        ExposureProperties exposureProperties,
        Clock clock
    ) {
        this.cacheTemplate = cacheTemplate;
        this.engineMetrics = engineMetrics;
        this.clock = clock;
        this.ttl = exposureProperties.cache().ttl();
        this.externalEnabled = exposureProperties.cache().externalEnabled();
        this.localCache = Caffeine.newBuilder()
            .maximumSize(exposureProperties.cache().maxEntries())
            .recordStats()
            .build();
    }

    /**
     * 캐시된 노출 결과를 조회합니다.
     *
     * @param key 캐시 키 ({@code context:user:category})
     * @return 유효한 캐시 값 (없으면 empty)
     */
    public Optional<ExposureResponse> get(String key) {
        Optional<ExposureResponse> cached = peek(key);
        engineMetrics.recordCacheRequest(cached.isPresent());
        return cached;
    }

    /**
     * 요청 메트릭을 남기지 않고 조회합니다. 단일 실행 진입 직후의 재확인에 사용합니다.
     */
    public Optional<ExposureResponse> peek(String key) {
        return getExternal(key).or(() -> getLocal(key));
    }

    /**
     * 두 계층 모두에 노출 결과를 저장합니다.
     *
     * @param key 캐시 키
     * @param payload 노출 결과
     * @param expiresAt 만료 시각
     */
    public void set(String key, ExposureResponse payload, Instant expiresAt) {
        Instant now = clock.instant();
        localCache.put(key, new LocalEntry(now, expiresAt, payload));
        if (externalEnabled) {
            Duration remaining = Duration.between(now, expiresAt);
            if (!remaining.isNegative() && !remaining.isZero()) {
                cacheTemplate.put(cacheKey(key, remaining), payload);
            }
        }
    }

    /**
     * 단일 키를 두 계층에서 제거합니다.
     */
    public void clear(String key) {
        localCache.invalidate(key);
        if (externalEnabled) {
            cacheTemplate.evict(cacheKey(key, ttl));
        }
    }

    /**
     * 모든 엔트리를 제거합니다.
     */
    public void clear() {
        localCache.invalidateAll();
        if (externalEnabled) {
            long evicted = cacheTemplate.evictByPrefix(KEY_PREFIX);
            log.info("공유 노출 캐시 전체 삭제: evicted={}", evicted);
        }
    }

    /**
     * 메트릭 바인딩용 Caffeine 캐시.
     */
    public Cache<String, LocalEntry> nativeCache() {
        return localCache;
    }

    private Optional<ExposureResponse> getExternal(String key) {
        if (!externalEnabled) {
            return Optional.empty();
        }
        return cacheTemplate.get(cacheKey(key, ttl))
            .filter(payload -> payload.expiresAt() == null || payload.expiresAt().toInstant().isAfter(clock.instant()));
    }

    private Optional<ExposureResponse> getLocal(String key) {
        LocalEntry entry = localCache.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant(), ttl)) {
            localCache.asMap().remove(key, entry);
            log.debug("로컬 노출 캐시 만료: key={}", key);
            return Optional.empty();
        }
        return Optional.of(entry.payload());
    }

    private SimpleCacheKey<ExposureResponse> cacheKey(String key, Duration entryTtl) {
        return SimpleCacheKey.of(KEY_PREFIX + key, entryTtl, ExposureResponse.class);
    }

    /**
     * 로컬 캐시 엔트리.
     *
     * @param storedAt 저장 시각
     * @param expiresAt 만료 시각
     * @param payload 노출 결과
     */
    public record LocalEntry(Instant storedAt, Instant expiresAt, ExposureResponse payload) {

        boolean isExpired(Instant now, Duration ttl) {
            return !now.isBefore(storedAt.plus(ttl)) || !now.isBefore(expiresAt);
        }
    }
}
