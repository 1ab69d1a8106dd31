package com.rateview.domain.promotion;

public enum PromotionType {
    CATEGORY,
    PRODUCT,
    CUSTOMER
}
