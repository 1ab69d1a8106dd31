package com.rateview.infrastructure.exposure;

import com.rateview.domain.exposure.ExposureSlot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * ExposureSlot JPA Repository.
 */
public interface ExposureSlotJpaRepository extends JpaRepository<ExposureSlot, Long> {

    Optional<ExposureSlot> findByContextKeyAndUserKey(String contextKey, String userKey);

    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM ExposureSlot s WHERE s.contextKey = :contextKey AND s.userKey = :userKey")
    int deleteSlot(@Param("contextKey") String contextKey, @Param("userKey") String userKey);

    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM ExposureSlot s")
    int deleteAllSlots();
}
