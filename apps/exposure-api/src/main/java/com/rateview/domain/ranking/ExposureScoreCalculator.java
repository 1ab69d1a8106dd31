package com.rateview.domain.ranking;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * 배치 상대 정규화 점수 계산기.
 * <p>
 * 각 원시 신호를 이번 실행 후보군의 최댓값으로 나누어 [0, 1]로 정규화하고,
 * exposure = clamp(wPop * popularity + wStrategic * ((cold + freshness) / 2), 0, 1) 로 결합합니다.
 * </p>
 * <p>
 * 분모가 실행마다 달라지므로 점수는 같은 실행 안에서만 비교 가능합니다.
 * 고정 분모로 바꾸면 기존 노출 결과가 달라지므로 현재 동작을 유지합니다.
 * </p>
 *
 * @author Rateview
 * @version 1.0
 */
public class ExposureScoreCalculator {

    private static final int SCALE = 4;

    private final double popularityWeight;
    private final double strategicWeight;

    public ExposureScoreCalculator(double popularityWeight, double strategicWeight) {
        this.popularityWeight = popularityWeight;
        this.strategicWeight = strategicWeight;
    }

    /**
     * 후보군 전체를 정규화하여 점수를 계산합니다.
     *
     * @param signals 이번 실행의 원시 신호 목록
     * @return 입력 순서를 유지한 점수 목록
     */
    public List<RankingScores> calculate(List<RawSignals> signals) {
        double maxPopularity = divisor(signals, RawSignals::popularityRaw);
        double maxProfit = divisor(signals, RawSignals::profitRaw);
        double maxCold = divisor(signals, RawSignals::coldRaw);

        return signals.stream()
            .map(signal -> {
                double popularity = round(signal.popularityRaw() / maxPopularity);
                double profit = round(signal.profitRaw() / maxProfit);
                double cold = round(Math.min(1.0, signal.coldRaw() / maxCold));
                double freshness = round(clamp(signal.freshness()));
                double strategic = (cold + freshness) / 2;
                double exposure = round(clamp(popularityWeight * popularity + strategicWeight * strategic));
                return new RankingScores(signal.productId(), popularity, cold, profit, freshness, exposure);
            })
            .toList();
    }

    private double divisor(List<RawSignals> signals, ToDoubleFunction<RawSignals> extractor) {
        double max = signals.stream().mapToDouble(extractor).max().orElse(0.0);
        return max > 0.0 ? max : 1.0;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP).doubleValue();
    }
}
