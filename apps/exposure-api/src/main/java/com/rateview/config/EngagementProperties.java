package com.rateview.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 참여 이벤트 수집 설정.
 *
 * @param dedup 중복 이벤트 제거 설정
 */
@ConfigurationProperties(prefix = "engagement")
public record EngagementProperties(
    Dedup dedup
) {
    public EngagementProperties {
        dedup = dedup == null ? new Dedup(10_000, Duration.ofHours(2)) : dedup;
    }

    /**
     * @param maxSize 기억할 최대 중복 키 수
     * @param window 중복 키 보관 시간 (시간 단위 버킷보다 길어야 함)
     */
    public record Dedup(
        long maxSize,
        Duration window
    ) {
    }
}
