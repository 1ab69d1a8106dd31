package com.rateview.domain;

import jakarta.persistence.Column;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import lombok.Getter;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * 공통 엔티티 기반 클래스.
 * <p>
 * 식별자와 생성/수정/삭제 시각을 관리합니다.
 * 모든 시각은 UTC 기준으로 기록합니다.
 * </p>
 *
 * @author Rateview
 * @version 1.0
 */
@MappedSuperclass
@Getter
public abstract class BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "created_at", nullable = false, updatable = false)
    private ZonedDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private ZonedDateTime updatedAt;

    @Column(name = "deleted_at")
    private ZonedDateTime deletedAt;

    /**
     * 영속화 직전 엔티티 상태를 검증합니다.
     * <p>
     * 하위 엔티티는 필요한 경우 재정의하여 불변식을 검사합니다.
     * </p>
     */
    protected void guard() {
    }

    @PrePersist
    private void prePersist() {
        guard();
        ZonedDateTime now = ZonedDateTime.now(ZoneOffset.UTC);
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    private void preUpdate() {
        guard();
        this.updatedAt = ZonedDateTime.now(ZoneOffset.UTC);
    }

    /**
     * 엔티티를 삭제 상태로 표시합니다. 이미 삭제된 경우 아무 것도 하지 않습니다.
     */
    public void delete() {
        if (this.deletedAt == null) {
            this.deletedAt = ZonedDateTime.now(ZoneOffset.UTC);
        }
    }

    public boolean isDeleted() {
        return this.deletedAt != null;
    }
}
