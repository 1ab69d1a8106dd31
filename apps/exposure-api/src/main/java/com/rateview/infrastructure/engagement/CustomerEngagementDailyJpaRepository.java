package com.rateview.infrastructure.engagement;

import com.rateview.domain.engagement.CustomerEngagementDaily;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * CustomerEngagementDaily JPA Repository.
 */
public interface CustomerEngagementDailyJpaRepository extends JpaRepository<CustomerEngagementDaily, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CustomerEngagementDaily c WHERE c.customerId = :customerId AND c.statDate = :statDate")
    Optional<CustomerEngagementDaily> findByCustomerIdAndStatDateForUpdate(
        @Param("customerId") String customerId,
        @Param("statDate") LocalDate statDate
    );

    List<CustomerEngagementDaily> findAllByCustomerIdOrderByStatDateAsc(String customerId);

    List<CustomerEngagementDaily> findAllByCustomerIdAndStatDate(String customerId, LocalDate statDate);
}
