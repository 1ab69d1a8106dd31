package com.rateview.infrastructure.engagement;

import com.rateview.domain.engagement.EngagementDaily;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * EngagementDaily JPA Repository.
 */
public interface EngagementDailyJpaRepository extends JpaRepository<EngagementDaily, Long> {

    List<EngagementDaily> findAllByStatDateGreaterThanEqualOrderByProductIdAscStatDateAsc(LocalDate fromDate);

    /**
     * 상품/일자 집계 행을 조회합니다. (비관적 락)
     * <p>
     * 같은 행에 대한 동시 증가를 직렬화합니다.
     * </p>
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM EngagementDaily e WHERE e.productId = :productId AND e.statDate = :statDate")
    Optional<EngagementDaily> findByProductIdAndStatDateForUpdate(
        @Param("productId") Long productId,
        @Param("statDate") LocalDate statDate
    );

    List<EngagementDaily> findAllByProductIdOrderByStatDateAsc(Long productId);

    List<EngagementDaily> findAllByProductIdAndStatDate(Long productId, LocalDate statDate);
}
