package com.rateview.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 노출 가중치 합 검증.
 * <p>
 * popularity + strategic 가중치는 1.0이어야 점수가 [0, 1] 범위를 고르게 사용합니다.
 * 기본은 경고만 남기며, exposure.strict-weights=true이면 기동을 중단합니다.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExposureWeightsValidator {

    private static final double TOLERANCE = 1e-6;

    private final ExposureProperties exposureProperties;

    @PostConstruct
    public void validate() {
        double sum = exposureProperties.popularityWeight() + exposureProperties.strategicWeight();
        if (Math.abs(sum - 1.0) <= TOLERANCE) {
            return;
        }
        String message = String.format(
            "노출 가중치 합이 1.0이 아닙니다. (popularity=%s, strategic=%s, sum=%s)",
            exposureProperties.popularityWeight(), exposureProperties.strategicWeight(), sum);
        if (exposureProperties.strictWeights()) {
            throw new IllegalStateException(message);
        }
        log.warn(message);
    }
}
