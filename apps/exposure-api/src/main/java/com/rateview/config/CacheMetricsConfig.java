package com.rateview.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.rateview.application.engagement.EngagementEventDeduplicator;
import com.rateview.application.exposure.ExposureCache;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;

/**
 * Caffeine 기반 로컬 캐시 메트릭을 Micrometer/Prometheus로 노출하기 위한 수동 바인딩 설정.
 *
 * - 캐시별 엔트리 수(caffeine_cache_size)
 * - 캐시별 누적 히트/미스(caffeine_cache_hits_total, caffeine_cache_misses_total)
 * - 대상: exposure(노출 결과 로컬 계층), engagementDedup(이벤트 중복 키)
 */
@Configuration
public class CacheMetricsConfig {

    private final ExposureCache exposureCache;
    private final EngagementEventDeduplicator engagementEventDeduplicator;
    private final MeterRegistry meterRegistry;

    public CacheMetricsConfig(
        ExposureCache exposureCache,
        EngagementEventDeduplicator engagementEventDeduplicator,
        MeterRegistry meterRegistry
    ) {
        this.exposureCache = exposureCache;
        this.engagementEventDeduplicator = engagementEventDeduplicator;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void bindCaffeineCachesToMetrics() {
        bind("exposure", exposureCache.nativeCache());
        bind("engagementDedup", engagementEventDeduplicator.nativeCache());
    }

    private void bind(String cacheName, Cache<?, ?> nativeCache) {
        Tags tags = Tags.of("cache", cacheName);

        Gauge.builder("caffeine_cache_size", nativeCache, Cache::estimatedSize)
            .tags(tags)
            .register(meterRegistry);

        FunctionCounter.builder("caffeine_cache_hits_total", nativeCache, c -> c.stats().hitCount())
            .tags(tags)
            .register(meterRegistry);

        FunctionCounter.builder("caffeine_cache_misses_total", nativeCache, c -> c.stats().missCount())
            .tags(tags)
            .register(meterRegistry);
    }
}
