package com.rateview.domain.engagement;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * 고객 일별 참여 집계 Repository 인터페이스.
 */
public interface CustomerEngagementDailyRepository {

    Optional<CustomerEngagementDaily> findByCustomerIdAndDateForUpdate(String customerId, LocalDate statDate);

    /**
     * @param customerId 고객 ID
     * @param statDate 특정 일자 (null이면 전체)
     */
    List<CustomerEngagementDaily> findByCustomerId(String customerId, LocalDate statDate);

    CustomerEngagementDaily save(CustomerEngagementDaily customerEngagementDaily);
}
