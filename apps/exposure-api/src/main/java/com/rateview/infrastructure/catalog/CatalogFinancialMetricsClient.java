package com.rateview.infrastructure.catalog;

import com.rateview.config.AsyncConfig;
import com.rateview.config.CatalogProperties;
import com.rateview.config.Resilience4jConfig;
import com.rateview.domain.catalog.FinancialMetrics;
import com.rateview.domain.catalog.FinancialMetricsReader;
import com.rateview.domain.product.Product;
import com.rateview.domain.product.ProductRepository;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * 카탈로그 기반 재무 지표 조회 클라이언트.
 * <p>
 * 상품 카탈로그에서 가격, 재고, 카테고리를 읽어 재무 지표를 만듭니다.
 * 마진은 {@code 가격 × catalog.margin-rate}로 추정합니다.
 * </p>
 * <p>
 * 조회 1건은 Resilience4j {@link TimeLimiter}로 시간 상한을 두고 전용 스레드 풀에서 실행합니다.
 * 타임아웃, 예외, 상품 없음은 모두 {@link FinancialMetrics#empty()}로 응답합니다.
 * </p>
 *
 * @author Rateview
 * @version 1.0
 */
@Slf4j
@Component
public class CatalogFinancialMetricsClient implements FinancialMetricsReader {

    private final ProductRepository productRepository;
    private final TimeLimiter timeLimiter;
    private final ExecutorService executor;
    private final BigDecimal marginRate;

    public CatalogFinancialMetricsClient(
        ProductRepository productRepository,
        @Qualifier(Resilience4jConfig.CATALOG_TIME_LIMITER) TimeLimiter timeLimiter,
        @Qualifier(AsyncConfig.CATALOG_LOOKUP_EXECUTOR) ExecutorService executor,
        CatalogProperties catalogProperties
    ) {
        this.productRepository = productRepository;
        this.timeLimiter = timeLimiter;
        this.executor = executor;
        this.marginRate = catalogProperties.marginRate();
    }

    @Override
    public FinancialMetrics getFinancialMetrics(Long productId) {
        try {
            return timeLimiter.executeFutureSupplier(
                () -> CompletableFuture.supplyAsync(() -> load(productId), executor)
            );
        } catch (TimeoutException e) {
            log.warn("재무 지표 조회 타임아웃, 0 값으로 대체: productId={}", productId);
            return FinancialMetrics.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("재무 지표 조회 중 인터럽트, 0 값으로 대체: productId={}", productId);
            return FinancialMetrics.empty();
        } catch (Exception e) {
            log.warn("재무 지표 조회 실패, 0 값으로 대체: productId={}, error={}", productId, e.getMessage());
            return FinancialMetrics.empty();
        }
    }

    private FinancialMetrics load(Long productId) {
        return productRepository.findById(productId)
            .map(this::toFinancialMetrics)
            .orElseGet(() -> {
                log.debug("카탈로그에 없는 상품: productId={}", productId);
                return FinancialMetrics.empty();
            });
    }

    private FinancialMetrics toFinancialMetrics(Product product) {
        BigDecimal price = product.getPrice() == null ? BigDecimal.ZERO : product.getPrice();
        int stock = product.getStock() == null ? 0 : product.getStock();
        return new FinancialMetrics(
            price.multiply(marginRate).setScale(2, RoundingMode.HALF_UP),
            stock,
            product.getCategoryId()
        );
    }
}
