package com.rateview.config;

import com.rateview.domain.exposure.ExposurePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 노출 구성(Exposure mix) 설정.
 * <p>
 * 모든 값은 코드 변경 없이 환경 변수(EXPOSURE_*)로 조정할 수 있습니다.
 * </p>
 *
 * @param popularityWeight 인기도 가중치 (EXPOSURE_POPULARITY_WEIGHT)
 * @param strategicWeight 전략(콜드/신선도) 가중치 (EXPOSURE_STRATEGIC_WEIGHT)
 * @param categoryCap 카테고리당 최대 노출 수, 0 이하이면 제한 없음 (EXPOSURE_CATEGORY_CAP)
 * @param coldThreshold 콜드 부스트 최소 cold_score (EXPOSURE_COLD_THRESHOLD)
 * @param stockThreshold in_stock / 콜드 부스트 최소 재고 (EXPOSURE_STOCK_THRESHOLD)
 * @param freshnessThreshold fresh 사유 최소 freshness_score (EXPOSURE_FRESHNESS_THRESHOLD)
 * @param strictWeights true이면 가중치 합이 1.0이 아닐 때 기동을 중단
 * @param buildWaitTimeout 같은 키의 선행 빌드를 기다리는 최대 시간
 * @param cache 캐시 설정
 */
@ConfigurationProperties(prefix = "exposure")
public record ExposureProperties(
    double popularityWeight,
    double strategicWeight,
    int categoryCap,
    double coldThreshold,
    int stockThreshold,
    double freshnessThreshold,
    boolean strictWeights,
    Duration buildWaitTimeout,
    Cache cache
) {
    public ExposureProperties {
        buildWaitTimeout = buildWaitTimeout == null ? Duration.ofSeconds(5) : buildWaitTimeout;
        cache = cache == null ? new Cache(600, true, 10_000) : cache;
    }

    /**
     * @param ttlSeconds 캐시/슬롯 유효 시간(초) (EXPOSURE_CACHE_TTL)
     * @param externalEnabled Redis 공유 캐시 사용 여부
     * @param maxEntries 로컬 캐시 최대 엔트리 수
     */
    public record Cache(
        long ttlSeconds,
        boolean externalEnabled,
        long maxEntries
    ) {
        public Duration ttl() {
            return Duration.ofSeconds(ttlSeconds);
        }
    }

    public ExposurePolicy toPolicy() {
        return new ExposurePolicy(
            popularityWeight,
            strategicWeight,
            categoryCap,
            coldThreshold,
            stockThreshold,
            freshnessThreshold
        );
    }
}
