package com.rateview.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /**
     * 엔진 전체의 시간 기준. 집계 일자와 캐시 만료는 모두 UTC로 계산합니다.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
