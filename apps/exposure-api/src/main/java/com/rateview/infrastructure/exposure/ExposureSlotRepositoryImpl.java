package com.rateview.infrastructure.exposure;

import com.rateview.domain.exposure.ExposureSlot;
import com.rateview.domain.exposure.ExposureSlotRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * ExposureSlotRepository의 JPA 구현체.
 */
@Component
@RequiredArgsConstructor
public class ExposureSlotRepositoryImpl implements ExposureSlotRepository {

    private final ExposureSlotJpaRepository exposureSlotJpaRepository;

    @Override
    public Optional<ExposureSlot> findByContextKeyAndUserKey(String contextKey, String userKey) {
        return exposureSlotJpaRepository.findByContextKeyAndUserKey(contextKey, userKey);
    }

    @Override
    public ExposureSlot save(ExposureSlot exposureSlot) {
        return exposureSlotJpaRepository.save(exposureSlot);
    }

    @Override
    @Transactional
    public long deleteByContextKeyAndUserKey(String contextKey, String userKey) {
        return exposureSlotJpaRepository.deleteSlot(contextKey, userKey);
    }

    @Override
    @Transactional
    public long deleteAll() {
        return exposureSlotJpaRepository.deleteAllSlots();
    }
}
