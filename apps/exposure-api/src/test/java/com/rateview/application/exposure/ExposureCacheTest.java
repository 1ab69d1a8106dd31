package com.rateview.application.exposure;

import com.rateview.application.metrics.EngineMetrics;
import com.rateview.cache.InMemoryCacheTemplate;
import com.rateview.cache.SimpleCacheKey;
import com.rateview.config.ExposureProperties;
import com.rateview.domain.exposure.ExposureItem;
import com.rateview.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ExposureCache 테스트.
 */
class ExposureCacheTest {

    private static final Instant NOW = Instant.parse("2024-12-15T06:00:00Z");
    private static final String KEY = "home:anon:all";

    private MutableClock clock;
    private InMemoryCacheTemplate cacheTemplate;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        cacheTemplate = new InMemoryCacheTemplate();
        meterRegistry = new SimpleMeterRegistry();
    }

    private ExposureCache cache(boolean externalEnabled) {
        ExposureProperties properties = new ExposureProperties(
            0.7, 0.3, 3, 0.6, 15, 0.7, false, null,
            new ExposureProperties.Cache(600, externalEnabled, 100)
        );
        return new ExposureCache(cacheTemplate, new EngineMetrics(meterRegistry), properties, clock);
    }

    private static ExposureResponse response(Long productId, Instant expiresAt) {
        OffsetDateTime generatedAt = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC);
        return new ExposureResponse("home", null, null, generatedAt, OffsetDateTime.ofInstant(expiresAt, ZoneOffset.UTC),
            List.of(new ExposureItem(productId, List.of("in_stock"), List.of())));
    }

    private double requests(String result) {
        return meterRegistry.get("exposure.cache.requests").tag("result", result).counter().count();
    }

    @DisplayName("저장 직후 조회하면 적중한다.")
    @Test
    void hitsImmediatelyAfterSet() {
        // arrange
        ExposureCache exposureCache = cache(true);
        ExposureResponse payload = response(1L, NOW.plusSeconds(600));

        // act
        exposureCache.set(KEY, payload, NOW.plusSeconds(600));
        Optional<ExposureResponse> cached = exposureCache.get(KEY);

        // assert
        assertThat(cached).contains(payload);
        assertThat(requests("hit")).isEqualTo(1.0);
    }

    @DisplayName("재확인 조회는 값을 돌려주되 캐시 요청 메트릭을 남기지 않는다.")
    @Test
    void peeksWithoutRecordingRequests() {
        // arrange
        ExposureCache exposureCache = cache(true);
        ExposureResponse payload = response(1L, NOW.plusSeconds(600));
        exposureCache.set(KEY, payload, NOW.plusSeconds(600));

        // act
        Optional<ExposureResponse> cached = exposureCache.peek(KEY);

        // assert
        assertThat(cached).contains(payload);
        assertThat(meterRegistry.find("exposure.cache.requests").counters()).isEmpty();
    }

    @DisplayName("만료 시각이 지나면 로컬 캐시는 미스를 반환하고 엔트리를 제거한다.")
    @Test
    void missesAfterExpiry_locally() {
        // arrange
        ExposureCache exposureCache = cache(false);
        exposureCache.set(KEY, response(1L, NOW.plusSeconds(600)), NOW.plusSeconds(600));

        // act
        clock.advance(Duration.ofSeconds(600));
        Optional<ExposureResponse> cached = exposureCache.get(KEY);

        // assert
        assertThat(cached).isEmpty();
        assertThat(exposureCache.nativeCache().getIfPresent(KEY)).isNull();
        assertThat(requests("miss")).isEqualTo(1.0);
    }

    @DisplayName("공유 캐시 값도 만료 시각이 지났으면 사용하지 않는다.")
    @Test
    void ignoresExpiredExternalPayload() {
        // arrange
        ExposureCache exposureCache = cache(true);
        exposureCache.set(KEY, response(1L, NOW.plusSeconds(600)), NOW.plusSeconds(600));

        // act
        clock.advance(Duration.ofSeconds(601));
        Optional<ExposureResponse> cached = exposureCache.get(KEY);

        // assert
        assertThat(cached).isEmpty();
    }

    @DisplayName("공유 캐시에 값이 있으면 로컬 캐시보다 먼저 사용한다.")
    @Test
    void prefersExternalValue() {
        // arrange
        ExposureCache exposureCache = cache(true);
        exposureCache.set(KEY, response(1L, NOW.plusSeconds(600)), NOW.plusSeconds(600));
        ExposureResponse fromOtherInstance = response(2L, NOW.plusSeconds(600));
        cacheTemplate.put(SimpleCacheKey.of(
            ExposureCache.KEY_PREFIX + KEY, Duration.ofSeconds(600), ExposureResponse.class), fromOtherInstance);

        // act
        Optional<ExposureResponse> cached = exposureCache.get(KEY);

        // assert
        assertThat(cached).contains(fromOtherInstance);
    }

    @DisplayName("공유 캐시가 장애여도 로컬 캐시로 응답한다.")
    @Test
    void fallsBackToLocal_whenExternalFails() {
        // arrange
        ExposureCache exposureCache = cache(true);
        cacheTemplate.failing(true);
        ExposureResponse payload = response(1L, NOW.plusSeconds(600));

        // act
        exposureCache.set(KEY, payload, NOW.plusSeconds(600));
        Optional<ExposureResponse> cached = exposureCache.get(KEY);

        // assert
        assertThat(cached).contains(payload);
    }

    @DisplayName("공유 캐시 TTL은 만료 시각까지 남은 시간이다.")
    @Test
    void storesRemainingTtlExternally() {
        // arrange
        ExposureCache exposureCache = cache(true);

        // act
        exposureCache.set(KEY, response(1L, NOW.plusSeconds(120)), NOW.plusSeconds(120));

        // assert
        assertThat(cacheTemplate.keyOf(ExposureCache.KEY_PREFIX + KEY).ttl()).isEqualTo(Duration.ofSeconds(120));
    }

    @DisplayName("키 단위 삭제는 해당 키만 두 계층에서 제거한다.")
    @Test
    void clearsSingleKey() {
        // arrange
        ExposureCache exposureCache = cache(true);
        String otherKey = "home:user-1:all";
        exposureCache.set(KEY, response(1L, NOW.plusSeconds(600)), NOW.plusSeconds(600));
        exposureCache.set(otherKey, response(2L, NOW.plusSeconds(600)), NOW.plusSeconds(600));

        // act
        exposureCache.clear(KEY);

        // assert
        assertThat(exposureCache.get(KEY)).isEmpty();
        assertThat(exposureCache.get(otherKey)).isPresent();
        assertThat(cacheTemplate.contains(ExposureCache.KEY_PREFIX + KEY)).isFalse();
    }

    @DisplayName("전체 삭제는 두 계층의 모든 노출 엔트리를 제거한다.")
    @Test
    void clearsAll() {
        // arrange
        ExposureCache exposureCache = cache(true);
        exposureCache.set(KEY, response(1L, NOW.plusSeconds(600)), NOW.plusSeconds(600));
        exposureCache.set("home:user-1:all", response(2L, NOW.plusSeconds(600)), NOW.plusSeconds(600));

        // act
        exposureCache.clear();

        // assert
        assertThat(exposureCache.get(KEY)).isEmpty();
        assertThat(exposureCache.get("home:user-1:all")).isEmpty();
    }
}
