package com.rateview.application.engagement;

import com.rateview.domain.engagement.CustomerEngagementDaily;
import com.rateview.domain.engagement.CustomerEngagementDailyRepository;
import com.rateview.domain.engagement.EngagementDaily;
import com.rateview.domain.engagement.EngagementDailyRepository;
import com.rateview.domain.engagement.EngagementEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

/**
 * 참여 이벤트 수집 서비스.
 * <p>
 * 이벤트를 중복 제거한 뒤 이벤트 발생일(UTC)의 상품 일별 집계에 더하고,
 * 사용자 ID가 있으면 고객 일별 집계에도 더합니다.
 * </p>
 * <p>
 * <b>집계 규칙:</b>
 * <ul>
 *   <li>view, click: 1 증가</li>
 *   <li>add_to_cart: 수량만큼 증가 (없으면 1)</li>
 *   <li>purchase: 수량만큼 증가, 매출 = 단가 × 수량, 고객 포인트 = 수량 × 10</li>
 * </ul>
 * </p>
 *
 * @author Rateview
 * @version 1.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EngagementService {

    private final EngagementDailyRepository engagementDailyRepository;
    private final CustomerEngagementDailyRepository customerEngagementDailyRepository;
    private final EngagementEventDeduplicator deduplicator;

    /**
     * 참여 이벤트를 기록합니다.
     *
     * @param event 참여 이벤트
     * @return 기록 결과 (중복이면 accepted=false)
     */
    @Transactional
    public EngagementInfo.Recorded recordEvent(EngagementEvent event) {
        String dedupKey = event.dedupKey();
        if (!deduplicator.markIfFirstSeen(dedupKey)) {
            log.debug("중복 이벤트 무시: key={}", dedupKey);
            return EngagementInfo.Recorded.duplicate();
        }

        try {
            LocalDate statDate = event.statDate();
            EngagementDaily daily = engagementDailyRepository
                .findByProductIdAndDateForUpdate(event.productId(), statDate)
                .orElseGet(() -> new EngagementDaily(event.productId(), statDate));
            daily.accumulate(event.productDelta());
            EngagementDaily saved = engagementDailyRepository.save(daily);

            if (event.userId() != null) {
                CustomerEngagementDaily customerDaily = customerEngagementDailyRepository
                    .findByCustomerIdAndDateForUpdate(event.userId(), statDate)
                    .orElseGet(() -> new CustomerEngagementDaily(event.userId(), statDate));
                customerDaily.accumulate(event.customerDelta());
                customerEngagementDailyRepository.save(customerDaily);
            }
            return new EngagementInfo.Recorded(true, EngagementInfo.ProductDaily.from(saved));
        } catch (RuntimeException e) {
            deduplicator.forget(dedupKey);
            log.warn("참여 이벤트 집계 실패: key={}, error={}", dedupKey, e.getMessage());
            throw e;
        }
    }

    /**
     * 상품 일별 집계를 조회합니다.
     *
     * @param productId 상품 ID
     * @param day 특정 일자 (null이면 전체)
     */
    @Transactional(readOnly = true)
    public List<EngagementInfo.ProductDaily> getProductEngagement(Long productId, LocalDate day) {
        return engagementDailyRepository.findByProductId(productId, day).stream()
            .map(EngagementInfo.ProductDaily::from)
            .toList();
    }

    /**
     * 고객 일별 집계를 조회합니다.
     *
     * @param userId 고객 ID
     * @param day 특정 일자 (null이면 전체)
     */
    @Transactional(readOnly = true)
    public List<EngagementInfo.CustomerDaily> getCustomerEngagement(String userId, LocalDate day) {
        return customerEngagementDailyRepository.findByCustomerId(userId, day).stream()
            .map(EngagementInfo.CustomerDaily::from)
            .toList();
    }
}
