package com.rateview.domain.exposure;

import java.util.Optional;

/**
 * ExposureSlot Repository 인터페이스.
 */
public interface ExposureSlotRepository {

    Optional<ExposureSlot> findByContextKeyAndUserKey(String contextKey, String userKey);

    ExposureSlot save(ExposureSlot exposureSlot);

    /**
     * @return 삭제된 행 수
     */
    long deleteByContextKeyAndUserKey(String contextKey, String userKey);

    /**
     * @return 삭제된 행 수
     */
    long deleteAll();
}
