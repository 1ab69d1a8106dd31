package com.rateview.infrastructure.engagement;

import com.rateview.domain.engagement.CustomerEngagementDaily;
import com.rateview.domain.engagement.CustomerEngagementDailyRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * CustomerEngagementDailyRepository의 JPA 구현체.
 */
@Component
@RequiredArgsConstructor
public class CustomerEngagementDailyRepositoryImpl implements CustomerEngagementDailyRepository {

    private final CustomerEngagementDailyJpaRepository customerEngagementDailyJpaRepository;

    @Override
    public Optional<CustomerEngagementDaily> findByCustomerIdAndDateForUpdate(String customerId, LocalDate statDate) {
        return customerEngagementDailyJpaRepository.findByCustomerIdAndStatDateForUpdate(customerId, statDate);
    }

    @Override
    public List<CustomerEngagementDaily> findByCustomerId(String customerId, LocalDate statDate) {
        if (statDate == null) {
            return customerEngagementDailyJpaRepository.findAllByCustomerIdOrderByStatDateAsc(customerId);
        }
        return customerEngagementDailyJpaRepository.findAllByCustomerIdAndStatDate(customerId, statDate);
    }

    @Override
    public CustomerEngagementDaily save(CustomerEngagementDaily customerEngagementDaily) {
        return customerEngagementDailyJpaRepository.save(customerEngagementDaily);
    }
}
