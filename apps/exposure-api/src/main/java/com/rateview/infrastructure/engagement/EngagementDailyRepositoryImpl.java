package com.rateview.infrastructure.engagement;

import com.rateview.domain.engagement.EngagementDaily;
import com.rateview.domain.engagement.EngagementDailyRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * EngagementDailyRepository의 JPA 구현체.
 *
 * @author Rateview
 * @version 1.0
 */
@Component
@RequiredArgsConstructor
public class EngagementDailyRepositoryImpl implements EngagementDailyRepository {

    private final EngagementDailyJpaRepository engagementDailyJpaRepository;

    /**
     * {@inheritDoc}
     */
    @Override
    public List<EngagementDaily> findAllSince(LocalDate fromDate) {
        return engagementDailyJpaRepository.findAllByStatDateGreaterThanEqualOrderByProductIdAscStatDateAsc(fromDate);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<EngagementDaily> findByProductIdAndDateForUpdate(Long productId, LocalDate statDate) {
        return engagementDailyJpaRepository.findByProductIdAndStatDateForUpdate(productId, statDate);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public List<EngagementDaily> findByProductId(Long productId, LocalDate statDate) {
        if (statDate == null) {
            return engagementDailyJpaRepository.findAllByProductIdOrderByStatDateAsc(productId);
        }
        return engagementDailyJpaRepository.findAllByProductIdAndStatDate(productId, statDate);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public EngagementDaily save(EngagementDaily engagementDaily) {
        return engagementDailyJpaRepository.save(engagementDaily);
    }
}
