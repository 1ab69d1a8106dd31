package com.rateview.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * 카탈로그(재무 지표) 연동 설정.
 *
 * @param marginRate 판매가 대비 마진 비율
 * @param timeout 상품 1건 조회 타임아웃
 * @param lookupThreads 조회 전용 스레드 수
 */
@ConfigurationProperties(prefix = "catalog")
public record CatalogProperties(
    BigDecimal marginRate,
    Duration timeout,
    int lookupThreads
) {
    public CatalogProperties {
        marginRate = marginRate == null ? new BigDecimal("0.35") : marginRate;
        timeout = timeout == null ? Duration.ofMillis(300) : timeout;
        lookupThreads = lookupThreads <= 0 ? 4 : lookupThreads;
    }
}
