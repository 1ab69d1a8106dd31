package com.rateview.config;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Resilience4j TimeLimiter 설정.
 * <p>
 * 외부 협력 모듈(카탈로그/재고) 조회가 노출 빌드나 점수 계산을 무기한 붙잡지 않도록
 * 호출 1건당 시간 상한을 둡니다. 타임아웃된 조회는 취소되고 호출자는 0 값으로 대체합니다.
 * </p>
 */
@Slf4j
@Configuration
public class Resilience4jConfig {

    public static final String CATALOG_TIME_LIMITER = "catalogTimeLimiter";

    @Bean
    public TimeLimiterRegistry timeLimiterRegistry(CatalogProperties catalogProperties) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
            .timeoutDuration(catalogProperties.timeout())
            .cancelRunningFuture(true)
            .build();
        log.info("카탈로그 조회 TimeLimiter 설정: timeout={}", catalogProperties.timeout());
        return TimeLimiterRegistry.of(config);
    }

    @Bean(name = CATALOG_TIME_LIMITER)
    public TimeLimiter catalogTimeLimiter(TimeLimiterRegistry timeLimiterRegistry) {
        return timeLimiterRegistry.timeLimiter("catalog");
    }
}
