package com.rateview.infrastructure.promotion;

import com.rateview.domain.promotion.Promotion;
import com.rateview.domain.promotion.PromotionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.ZonedDateTime;
import java.util.List;

/**
 * Promotion JPA Repository.
 */
public interface PromotionJpaRepository extends JpaRepository<Promotion, Long> {

    @Query("SELECT DISTINCT p FROM Promotion p "
        + "WHERE p.status = :status AND p.startAt <= :now AND p.endAt >= :now AND p.deletedAt IS NULL "
        + "ORDER BY p.id ASC")
    List<Promotion> findAllByStatusAt(@Param("status") PromotionStatus status, @Param("now") ZonedDateTime now);
}
