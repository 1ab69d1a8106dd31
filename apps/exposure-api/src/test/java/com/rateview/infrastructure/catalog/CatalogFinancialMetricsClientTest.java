package com.rateview.infrastructure.catalog;

import com.rateview.domain.catalog.FinancialMetrics;
import com.rateview.domain.product.Product;
import com.rateview.domain.product.ProductRepository;
import com.rateview.config.CatalogProperties;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

/**
 * CatalogFinancialMetricsClient 테스트.
 */
@ExtendWith(MockitoExtension.class)
class CatalogFinancialMetricsClientTest {

    @Mock
    private ProductRepository productRepository;

    private ExecutorService executor;
    private CatalogFinancialMetricsClient client;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        TimeLimiter timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
            .timeoutDuration(Duration.ofMillis(100))
            .cancelRunningFuture(true)
            .build());
        client = new CatalogFinancialMetricsClient(productRepository, timeLimiter, executor,
            new CatalogProperties(new BigDecimal("0.35"), Duration.ofMillis(100), 2));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @DisplayName("마진은 가격 × 마진 비율이며 재고와 카테고리를 함께 반환한다.")
    @Test
    void mapsProductToFinancialMetrics() {
        // arrange
        when(productRepository.findById(1L)).thenReturn(Optional.of(
            Product.of("머그컵", new BigDecimal("10000"), 42, 7L)));

        // act
        FinancialMetrics metrics = client.getFinancialMetrics(1L);

        // assert
        assertThat(metrics.margin()).isEqualByComparingTo("3500.00");
        assertThat(metrics.stockOnHand()).isEqualTo(42);
        assertThat(metrics.categoryId()).isEqualTo(7L);
    }

    @DisplayName("카탈로그에 없는 상품은 0 값을 반환한다.")
    @Test
    void returnsEmpty_whenProductMissing() {
        // arrange
        when(productRepository.findById(1L)).thenReturn(Optional.empty());

        // act
        FinancialMetrics metrics = client.getFinancialMetrics(1L);

        // assert
        assertThat(metrics).isEqualTo(FinancialMetrics.empty());
    }

    @DisplayName("조회가 시간 상한을 넘으면 0 값을 반환한다.")
    @Test
    void returnsEmpty_whenLookupTimesOut() {
        // arrange
        when(productRepository.findById(1L)).thenAnswer(invocation -> {
            Thread.sleep(1_000);
            return Optional.empty();
        });

        // act
        FinancialMetrics metrics = client.getFinancialMetrics(1L);

        // assert
        assertThat(metrics).isEqualTo(FinancialMetrics.empty());
    }

    @DisplayName("조회 중 예외가 발생하면 0 값을 반환한다.")
    @Test
    void returnsEmpty_whenLookupFails() {
        // arrange
        when(productRepository.findById(1L)).thenThrow(new IllegalStateException("catalog down"));

        // act
        FinancialMetrics metrics = client.getFinancialMetrics(1L);

        // assert
        assertThat(metrics).isEqualTo(FinancialMetrics.empty());
    }

    @DisplayName("조회 중 인터럽트되면 0 값을 반환하고 인터럽트 상태를 유지한다.")
    @Test
    void keepsInterruptFlag_whenInterruptedDuringLookup() {
        // arrange
        lenient().when(productRepository.findById(1L)).thenAnswer(invocation -> {
            Thread.sleep(1_000);
            return Optional.empty();
        });
        Thread.currentThread().interrupt();

        // act
        FinancialMetrics metrics = client.getFinancialMetrics(1L);

        // assert
        boolean interrupted = Thread.interrupted();
        assertThat(metrics).isEqualTo(FinancialMetrics.empty());
        assertThat(interrupted).isTrue();
    }
}
