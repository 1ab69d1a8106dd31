package com.rateview.domain.promotion;

public enum PromotionStatus {
    DRAFT,
    ACTIVE,
    SCHEDULED,
    EXPIRED
}
