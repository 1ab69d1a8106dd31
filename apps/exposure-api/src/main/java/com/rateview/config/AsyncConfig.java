package com.rateview.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 비동기 처리를 위한 ExecutorService 설정.
 */
@Configuration
public class AsyncConfig {

    public static final String CATALOG_LOOKUP_EXECUTOR = "catalogLookupExecutor";

    /**
     * 카탈로그 재무 지표 조회 전용 ExecutorService.
     * <p>
     * TimeLimiter가 타임아웃된 조회를 호출 스레드와 분리해 취소할 수 있도록 별도 풀에서 실행합니다.
     * </p>
     *
     * @param catalogProperties 카탈로그 설정
     * @return ExecutorService 인스턴스
     */
    @Bean(name = CATALOG_LOOKUP_EXECUTOR)
    public ExecutorService catalogLookupExecutor(CatalogProperties catalogProperties) {
        return Executors.newFixedThreadPool(
            catalogProperties.lookupThreads(),
            new ThreadFactory() {
                private final AtomicInteger threadNumber = new AtomicInteger(1);

                @Override
                public Thread newThread(Runnable r) {
                    Thread t = new Thread(r, "catalog-lookup-" + threadNumber.getAndIncrement());
                    t.setDaemon(true);
                    return t;
                }
            }
        );
    }
}
