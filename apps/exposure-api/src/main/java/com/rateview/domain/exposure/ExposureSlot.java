package com.rateview.domain.exposure;

import com.rateview.domain.BaseEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

/**
 * 마지막으로 구성한 노출 결과 슬롯.
 * <p>
 * (context_key, user_key)당 하나만 존재합니다. 캐시 재현용 저장소이자
 * 다음 구성 시 직전 노출 상품(반복 회피)의 근거입니다.
 * </p>
 */
@Entity
@Table(
    name = "exposure_slot",
    uniqueConstraints = @UniqueConstraint(name = "uk_exposure_slot_context_user", columnNames = {"context_key", "user_key"})
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
public class ExposureSlot extends BaseEntity {

    @Column(name = "context_key", nullable = false, length = 120)
    private String contextKey;

    @Column(name = "user_key", nullable = false, length = 64)
    private String userKey;

    @Column(name = "user_id", length = 64)
    private String userId;

    @Column(name = "payload_json", nullable = false, columnDefinition = "TEXT")
    private String payloadJson;

    @Column(name = "generated_at", nullable = false)
    private ZonedDateTime generatedAt;

    @Column(name = "expires_at", nullable = false)
    private ZonedDateTime expiresAt;

    private ExposureSlot(String contextKey, String userId) {
        this.contextKey = contextKey;
        this.userId = userId;
        this.userKey = ExposureKeys.userKey(userId);
    }

    public static ExposureSlot of(String contextKey, String userId, String payloadJson, ZonedDateTime generatedAt, ZonedDateTime expiresAt) {
        ExposureSlot slot = new ExposureSlot(contextKey, userId);
        slot.overwrite(payloadJson, generatedAt, expiresAt);
        return slot;
    }

    /**
     * 슬롯 내용을 새 결과로 덮어씁니다.
     */
    public void overwrite(String payloadJson, ZonedDateTime generatedAt, ZonedDateTime expiresAt) {
        this.payloadJson = payloadJson;
        this.generatedAt = generatedAt;
        this.expiresAt = expiresAt;
    }

    @Override
    protected void guard() {
        if (contextKey == null || contextKey.isBlank()) {
            throw new IllegalStateException("context_key는 비어 있을 수 없습니다.");
        }
        if (payloadJson == null) {
            throw new IllegalStateException("payload_json은 비어 있을 수 없습니다.");
        }
    }
}
