package com.rateview.application.engagement;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.rateview.config.EngagementProperties;
import org.springframework.stereotype.Component;

/**
 * 참여 이벤트 중복 제거기.
 * <p>
 * 최근 본 중복 제거 키를 크기 제한이 있는 Caffeine 캐시에 보관합니다.
 * 크기를 넘으면 오래 사용되지 않은 키부터 밀려나고, 기록 후 {@code window}가 지나면 만료됩니다.
 * </p>
 */
@Component
public class EngagementEventDeduplicator {

    private final Cache<String, Boolean> seenKeys;

    public EngagementEventDeduplicator(EngagementProperties engagementProperties) {
        this.seenKeys = Caffeine.newBuilder()
            .maximumSize(engagementProperties.dedup().maxSize())
            .expireAfterWrite(engagementProperties.dedup().window())
            .recordStats()
            .build();
    }

    /**
     * 처음 보는 키이면 기록하고 true를 반환합니다.
     *
     * @param dedupKey 중복 제거 키
     * @return 처음 보는 키이면 true, 이미 본 키이면 false
     */
    public boolean markIfFirstSeen(String dedupKey) {
        return seenKeys.asMap().putIfAbsent(dedupKey, Boolean.TRUE) == null;
    }

    /**
     * 기록한 키를 제거합니다. 집계 반영에 실패한 이벤트를 다시 받을 수 있게 합니다.
     */
    public void forget(String dedupKey) {
        seenKeys.invalidate(dedupKey);
    }

    public Cache<String, Boolean> nativeCache() {
        return seenKeys;
    }
}
