package com.rateview.application.exposure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rateview.application.metrics.EngineMetrics;
import com.rateview.application.promotion.PromotionQueryService;
import com.rateview.config.ExposureProperties;
import com.rateview.domain.catalog.FinancialMetrics;
import com.rateview.domain.catalog.FinancialMetricsReader;
import com.rateview.domain.exposure.ExposureItem;
import com.rateview.domain.exposure.ExposureSlot;
import com.rateview.domain.exposure.ExposureSlotRepository;
import com.rateview.domain.promotion.PromotionIndex;
import com.rateview.domain.ranking.ProductRankingRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static com.rateview.support.RankingFixtures.candidate;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ExposureBuilder 테스트.
 */
@ExtendWith(MockitoExtension.class)
class ExposureBuilderTest {

    private static final Instant NOW = Instant.parse("2024-12-15T06:00:00Z");

    @Mock
    private ProductRankingRepository productRankingRepository;

    @Mock
    private ExposureSlotRepository exposureSlotRepository;

    @Mock
    private PromotionQueryService promotionQueryService;

    @Mock
    private FinancialMetricsReader financialMetricsReader;

    @Mock
    private ExposureCache exposureCache;

    private ObjectMapper objectMapper;
    private ExposureBuilder exposureBuilder;

    @BeforeEach
    void setUp() {
        objectMapper = Jackson2ObjectMapperBuilder.json().build();
        ExposureProperties properties = new ExposureProperties(0.7, 0.3, 3, 0.6, 15, 0.7, false, null, null);
        exposureBuilder = new ExposureBuilder(
            productRankingRepository,
            exposureSlotRepository,
            promotionQueryService,
            financialMetricsReader,
            exposureCache,
            objectMapper,
            new EngineMetrics(new SimpleMeterRegistry()),
            properties,
            Clock.fixed(NOW, ZoneOffset.UTC)
        );
        when(promotionQueryService.loadIndex(any())).thenReturn(PromotionIndex.empty());
    }

    private String payloadOf(Long... productIds) throws Exception {
        OffsetDateTime generatedAt = OffsetDateTime.ofInstant(NOW.minusSeconds(3600), ZoneOffset.UTC);
        List<ExposureItem> mix = Arrays.stream(productIds)
            .map(id -> new ExposureItem(id, List.of(), List.of()))
            .toList();
        return objectMapper.writeValueAsString(
            new ExposureResponse("home", "user-1", null, generatedAt, generatedAt.plusMinutes(10), mix));
    }

    @DisplayName("후보는 limit의 4배를 조회하고, 새 슬롯과 캐시에 결과를 기록한다.")
    @Test
    void buildsAndPersistsNewSlot() {
        // arrange
        when(productRankingRepository.findTopCandidates(null, 8)).thenReturn(List.of(
            candidate(1L, 10L, 0.9),
            candidate(2L, 20L, 0.8)
        ));
        when(exposureSlotRepository.findByContextKeyAndUserKey("home|all", "user-1")).thenReturn(Optional.empty());
        when(financialMetricsReader.getFinancialMetrics(anyLong())).thenReturn(new FinancialMetrics(BigDecimal.ONE, 30, 10L));

        // act
        ExposureResponse response = exposureBuilder.buildExposure("home", "user-1", null, 2);

        // assert
        assertThat(response.mix()).extracting(ExposureItem::productId).containsExactly(1L, 2L);
        assertThat(response.generatedAt()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
        assertThat(response.expiresAt()).isEqualTo(OffsetDateTime.ofInstant(NOW.plusSeconds(600), ZoneOffset.UTC));

        ArgumentCaptor<ExposureSlot> slotCaptor = ArgumentCaptor.forClass(ExposureSlot.class);
        verify(exposureSlotRepository).save(slotCaptor.capture());
        ExposureSlot slot = slotCaptor.getValue();
        assertThat(slot.getContextKey()).isEqualTo("home|all");
        assertThat(slot.getUserKey()).isEqualTo("user-1");
        assertThat(slot.getExpiresAt()).isEqualTo(ZonedDateTime.ofInstant(NOW.plusSeconds(600), ZoneOffset.UTC));
        assertThat(slot.getPayloadJson()).contains("\"product_id\":1");

        verify(exposureCache).set(eq("home:user-1:all"), eq(response), eq(NOW.plusSeconds(600)));
    }

    @DisplayName("직전 슬롯의 상품은 새 후보가 충분하면 다시 노출하지 않고, 슬롯을 덮어쓴다.")
    @Test
    void avoidsPreviousMixAndOverwritesSlot() throws Exception {
        // arrange
        ExposureSlot previous = ExposureSlot.of("home|all", "user-1", payloadOf(1L),
            ZonedDateTime.ofInstant(NOW.minusSeconds(3600), ZoneOffset.UTC),
            ZonedDateTime.ofInstant(NOW.minusSeconds(3000), ZoneOffset.UTC));
        when(productRankingRepository.findTopCandidates(null, 4)).thenReturn(List.of(
            candidate(1L, 10L, 0.9),
            candidate(2L, 20L, 0.8)
        ));
        when(exposureSlotRepository.findByContextKeyAndUserKey("home|all", "user-1")).thenReturn(Optional.of(previous));
        when(financialMetricsReader.getFinancialMetrics(2L)).thenReturn(new FinancialMetrics(BigDecimal.ONE, 30, 20L));

        // act
        ExposureResponse response = exposureBuilder.buildExposure("home", "user-1", null, 1);

        // assert
        assertThat(response.mix()).extracting(ExposureItem::productId).containsExactly(2L);
        verify(exposureSlotRepository).save(previous);
        assertThat(previous.getPayloadJson()).contains("\"product_id\":2");
        assertThat(previous.getGeneratedAt()).isEqualTo(ZonedDateTime.ofInstant(NOW, ZoneOffset.UTC));
    }

    @DisplayName("직전 슬롯을 해석할 수 없으면 반복 회피 없이 구성한다.")
    @Test
    void ignoresCorruptPreviousSlot() {
        // arrange
        ExposureSlot corrupt = ExposureSlot.of("home|all", null, "{not-json",
            ZonedDateTime.ofInstant(NOW.minusSeconds(3600), ZoneOffset.UTC),
            ZonedDateTime.ofInstant(NOW.minusSeconds(3000), ZoneOffset.UTC));
        when(productRankingRepository.findTopCandidates(null, 4)).thenReturn(List.of(candidate(1L, 10L, 0.9)));
        when(exposureSlotRepository.findByContextKeyAndUserKey("home|all", "anon")).thenReturn(Optional.of(corrupt));
        when(financialMetricsReader.getFinancialMetrics(1L)).thenReturn(FinancialMetrics.empty());

        // act
        ExposureResponse response = exposureBuilder.buildExposure("home", null, null, 1);

        // assert
        assertThat(response.mix()).extracting(ExposureItem::productId).containsExactly(1L);
        verify(exposureSlotRepository).save(corrupt);
    }

    @DisplayName("재고는 한 번의 구성 안에서 상품당 한 번만 조회한다.")
    @Test
    void looksUpStockOncePerProduct() throws Exception {
        // arrange
        ExposureSlot previous = ExposureSlot.of("category|10", null, payloadOf(1L),
            ZonedDateTime.ofInstant(NOW.minusSeconds(3600), ZoneOffset.UTC),
            ZonedDateTime.ofInstant(NOW.minusSeconds(3000), ZoneOffset.UTC));
        when(productRankingRepository.findTopCandidates(10L, 20)).thenReturn(List.of(
            candidate(1L, 10L, 0.9),
            candidate(2L, 10L, 0.8)
        ));
        when(exposureSlotRepository.findByContextKeyAndUserKey("category|10", "anon")).thenReturn(Optional.of(previous));
        when(financialMetricsReader.getFinancialMetrics(anyLong())).thenReturn(new FinancialMetrics(BigDecimal.ONE, 30, 10L));

        // act
        ExposureResponse response = exposureBuilder.buildExposure("category", null, 10L, 5);

        // assert
        assertThat(response.mix()).extracting(ExposureItem::productId).containsExactly(2L, 1L);
        verify(financialMetricsReader, times(1)).getFinancialMetrics(1L);
        verify(financialMetricsReader, times(1)).getFinancialMetrics(2L);
    }

    @DisplayName("트랜잭션 안에서는 커밋된 뒤에만 캐시에 기록한다.")
    @Test
    void writesCacheOnlyAfterCommit() {
        // arrange
        when(productRankingRepository.findTopCandidates(null, 4)).thenReturn(List.of(candidate(1L, 10L, 0.9)));
        when(exposureSlotRepository.findByContextKeyAndUserKey("home|all", "anon")).thenReturn(Optional.empty());
        when(financialMetricsReader.getFinancialMetrics(1L)).thenReturn(FinancialMetrics.empty());
        TransactionSynchronizationManager.initSynchronization();

        try {
            // act
            ExposureResponse response = exposureBuilder.buildExposure("home", null, null, 1);

            // assert
            verify(exposureSlotRepository).save(any(ExposureSlot.class));
            verify(exposureCache, never()).set(any(), any(), any());

            TransactionSynchronizationManager.getSynchronizations().forEach(TransactionSynchronization::afterCommit);
            verify(exposureCache).set(eq("home:anon:all"), eq(response), eq(NOW.plusSeconds(600)));
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @DisplayName("커밋되지 않고 롤백되면 캐시에 기록하지 않는다.")
    @Test
    void skipsCache_whenRolledBack() {
        // arrange
        when(productRankingRepository.findTopCandidates(null, 4)).thenReturn(List.of(candidate(1L, 10L, 0.9)));
        when(exposureSlotRepository.findByContextKeyAndUserKey("home|all", "anon")).thenReturn(Optional.empty());
        when(financialMetricsReader.getFinancialMetrics(1L)).thenReturn(FinancialMetrics.empty());
        TransactionSynchronizationManager.initSynchronization();

        try {
            // act
            exposureBuilder.buildExposure("home", null, null, 1);
            TransactionSynchronizationManager.getSynchronizations()
                .forEach(sync -> sync.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK));

            // assert
            verify(exposureCache, never()).set(any(), any(), any());
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }
}
