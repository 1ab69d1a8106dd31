package com.rateview.domain.ranking;

/**
 * 반감기 기반 지수 감쇠.
 * <p>
 * factor(age) = exp(-age * ln2 / halfLifeDays). halfLifeDays일마다 가중치가 절반이 됩니다.
 * 반감기가 0 이하이면 감쇠하지 않습니다(1.0).
 * </p>
 *
 * @param halfLifeDays 반감기(일)
 */
public record HalfLifeDecay(double halfLifeDays) {

    private static final double LN2 = Math.log(2.0);

    public double factor(double ageDays) {
        if (halfLifeDays <= 0) {
            return 1.0;
        }
        return Math.exp(-Math.max(0.0, ageDays) * LN2 / halfLifeDays);
    }
}
