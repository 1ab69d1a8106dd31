package com.rateview.domain.ranking;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HalfLifeDecayTest {

    @DisplayName("반감기만큼 지나면 가중치가 절반이 된다.")
    @Test
    void halvesAfterHalfLife() {
        // arrange
        HalfLifeDecay decay = new HalfLifeDecay(3.0);

        // act & assert
        assertThat(decay.factor(0)).isEqualTo(1.0);
        assertThat(decay.factor(3.0)).isCloseTo(0.5, within(1e-9));
        assertThat(decay.factor(6.0)).isCloseTo(0.25, within(1e-9));
    }

    @DisplayName("음수 경과일(미래 일자)은 0일로 간주한다.")
    @Test
    void clampsNegativeAgeToZero() {
        // arrange
        HalfLifeDecay decay = new HalfLifeDecay(3.0);

        // act
        double factor = decay.factor(-2.0);

        // assert
        assertThat(factor).isEqualTo(1.0);
    }

    @DisplayName("반감기가 0 이하이면 감쇠하지 않는다.")
    @Test
    void doesNotDecay_whenHalfLifeIsNotPositive() {
        // arrange
        HalfLifeDecay decay = new HalfLifeDecay(0.0);

        // act
        double factor = decay.factor(10.0);

        // assert
        assertThat(factor).isEqualTo(1.0);
    }
}
