package com.rateview.domain.catalog;

/**
 * 상품 재무 지표 조회 협력 인터페이스.
 * <p>
 * 구현체는 예외를 던지지 않아야 합니다. 조회 실패나 타임아웃은 {@link FinancialMetrics#empty()}로 응답합니다.
 * </p>
 */
public interface FinancialMetricsReader {

    /**
     * @param productId 상품 ID
     * @return 재무 지표 (실패 시 0 값)
     */
    FinancialMetrics getFinancialMetrics(Long productId);
}
