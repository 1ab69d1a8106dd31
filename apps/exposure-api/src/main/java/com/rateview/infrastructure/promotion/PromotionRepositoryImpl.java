package com.rateview.infrastructure.promotion;

import com.rateview.domain.promotion.Promotion;
import com.rateview.domain.promotion.PromotionRepository;
import com.rateview.domain.promotion.PromotionStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.ZonedDateTime;
import java.util.List;

/**
 * PromotionRepository의 JPA 구현체.
 */
@Component
@RequiredArgsConstructor
public class PromotionRepositoryImpl implements PromotionRepository {

    private final PromotionJpaRepository promotionJpaRepository;

    /**
     * {@inheritDoc}
     */
    @Override
    public List<Promotion> findActiveAt(ZonedDateTime now) {
        return promotionJpaRepository.findAllByStatusAt(PromotionStatus.ACTIVE, now);
    }
}
