package com.rateview.application.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 노출/점수 엔진 메트릭.
 * <p>
 * 노출 구성 시간, 캐시 적중률, 점수 계산 실행을 Prometheus 메트릭으로 기록합니다.
 * </p>
 *
 * @author Rateview
 * @version 1.0
 */
@Component
@RequiredArgsConstructor
public class EngineMetrics {

    private final MeterRegistry meterRegistry;

    /**
     * 노출 구성 시간 측정을 시작합니다.
     */
    public Timer.Sample startSample() {
        return Timer.start(meterRegistry);
    }

    /**
     * 노출 구성 시간을 기록합니다.
     *
     * @param sample 시작 샘플
     */
    public void recordBuild(Timer.Sample sample) {
        sample.stop(meterRegistry.timer("exposure.build"));
    }

    /**
     * 캐시 조회 결과를 기록합니다.
     *
     * @param hit 적중 여부
     */
    public void recordCacheRequest(boolean hit) {
        meterRegistry.counter("exposure.cache.requests", "result", hit ? "hit" : "miss").increment();
    }

    /**
     * 점수 계산 실행 시간을 기록합니다.
     */
    public void recordScoringRun(Timer.Sample sample) {
        sample.stop(meterRegistry.timer("scoring.run"));
    }

    /**
     * 점수가 갱신된 상품 수를 기록합니다.
     */
    public void recordProductsUpdated(int count) {
        meterRegistry.counter("scoring.products.updated").increment(count);
    }
}
