package com.rateview.domain.exposure;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExposureKeysTest {

    @DisplayName("슬롯 키와 캐시 키는 카테고리가 없으면 all, 사용자가 없으면 anon을 사용한다.")
    @Test
    void usesPlaceholders() {
        // act & assert
        assertThat(ExposureKeys.slotKey("home", null)).isEqualTo("home|all");
        assertThat(ExposureKeys.slotKey("category", 7L)).isEqualTo("category|7");
        assertThat(ExposureKeys.cacheKey("home", null, null)).isEqualTo("home:anon:all");
        assertThat(ExposureKeys.cacheKey("carousel", "user-1", 7L)).isEqualTo("carousel:user-1:7");
    }
}
