package com.rateview.application.promotion;

import com.rateview.domain.promotion.ActivePromotion;
import com.rateview.domain.promotion.Promotion;
import com.rateview.domain.promotion.PromotionIndex;
import com.rateview.domain.promotion.PromotionRepository;
import com.rateview.support.error.CoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 활성 프로모션 조회 서비스.
 * <p>
 * 조건 형식이 잘못된 프로모션은 조회 시점에 걸러내고 WARN 로그를 남깁니다.
 * 노출 구성은 잘못된 프로모션 때문에 실패하지 않습니다.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PromotionQueryService {

    private final PromotionRepository promotionRepository;
    private final PromotionTargetParser promotionTargetParser;

    /**
     * 기준 시각에 활성 상태인 프로모션 목록을 조회합니다.
     *
     * @param now 기준 시각
     * @return 조건이 검증된 활성 프로모션
     */
    @Transactional(readOnly = true)
    public List<ActivePromotion> listActivePromotions(ZonedDateTime now) {
        List<ActivePromotion> active = new ArrayList<>();
        for (Promotion promotion : promotionRepository.findActiveAt(now)) {
            try {
                active.add(new ActivePromotion(
                    promotion.getId(),
                    promotion.getType(),
                    promotion.getScope(),
                    promotionTargetParser.parse(promotion)
                ));
            } catch (CoreException e) {
                log.warn("잘못된 프로모션 조건, 건너뜀: promotionId={}, reason={}", promotion.getId(), e.getMessage());
            }
        }
        return active;
    }

    /**
     * 활성 프로모션으로 조회 인덱스를 만듭니다.
     */
    @Transactional(readOnly = true)
    public PromotionIndex loadIndex(ZonedDateTime now) {
        return new PromotionIndex(listActivePromotions(now));
    }
}
