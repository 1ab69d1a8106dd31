package com.rateview.domain.promotion;

import java.time.ZonedDateTime;
import java.util.List;

/**
 * Promotion Repository 인터페이스.
 */
public interface PromotionRepository {

    /**
     * 상태가 ACTIVE이고 기간이 기준 시각을 포함하는 프로모션을 id 오름차순으로 조회합니다.
     *
     * @param now 기준 시각
     * @return 활성 프로모션 목록
     */
    List<Promotion> findActiveAt(ZonedDateTime now);
}
