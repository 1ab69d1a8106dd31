package com.rateview.application.exposure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rateview.application.metrics.EngineMetrics;
import com.rateview.application.promotion.PromotionQueryService;
import com.rateview.config.ExposureProperties;
import com.rateview.domain.catalog.FinancialMetricsReader;
import com.rateview.domain.exposure.ExposureItem;
import com.rateview.domain.exposure.ExposureKeys;
import com.rateview.domain.exposure.ExposureSelector;
import com.rateview.domain.exposure.ExposureSlot;
import com.rateview.domain.exposure.ExposureSlotRepository;
import com.rateview.domain.promotion.PromotionIndex;
import com.rateview.domain.ranking.ProductRankingRepository;
import com.rateview.domain.ranking.RankingCandidate;
import com.rateview.support.error.CoreException;
import com.rateview.support.error.ErrorType;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.ToIntFunction;

/**
 * 노출 구성 빌더.
 * <p>
 * 랭킹 상위 후보, 직전 노출 슬롯, 활성 프로모션, 재고를 모아 {@link ExposureSelector}로 노출 항목을 고르고,
 * 결과를 노출 슬롯과 캐시에 기록합니다.
 * </p>
 * <p>
 * <b>처리 순서:</b>
 * <ol>
 *   <li>슬롯 키 {@code context|category} 계산</li>
 *   <li>활성 프로모션 인덱스 로드</li>
 *   <li>exposure_score 상위 {@code limit * 4}개 후보 조회 (카테고리 필터 선택)</li>
 *   <li>직전 슬롯에서 노출했던 상품 ID 추출 (없거나 손상되면 빈 집합)</li>
 *   <li>신규 선택 → 보충 → 콜드 부스트</li>
 *   <li>생성/만료 시각 기록 후 슬롯 upsert, 커밋 후 캐시 write-through</li>
 * </ol>
 * </p>
 * <p>
 * 재고 조회는 한 번의 구성 안에서 상품당 한 번만 수행하며, 실패하면 재고 0으로 처리합니다.
 * </p>
 *
 * @author Rateview
 * @version 1.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExposureBuilder {

    private static final int CANDIDATE_MULTIPLIER = 4;

    private final ProductRankingRepository productRankingRepository;
    private final ExposureSlotRepository exposureSlotRepository;
    private final PromotionQueryService promotionQueryService;
    private final FinancialMetricsReader financialMetricsReader;
    private final ExposureCache exposureCache;
    private final ObjectMapper objectMapper;
    private final EngineMetrics engineMetrics;
    private final ExposureProperties exposureProperties;
    private final Clock clock;

    /**
     * 노출 구성을 새로 만듭니다.
     *
     * @param context 노출 컨텍스트
     * @param userId 사용자 ID (익명이면 null)
     * @param categoryId 카테고리 필터 (없으면 null)
     * @param limit 최대 항목 수
     * @return 노출 구성 결과
     */
    @Transactional
    public ExposureResponse buildExposure(String context, String userId, Long categoryId, int limit) {
        Timer.Sample sample = engineMetrics.startSample();
        ZonedDateTime now = ZonedDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
        String slotKey = ExposureKeys.slotKey(context, categoryId);
        String userKey = ExposureKeys.userKey(userId);

        PromotionIndex promotions = promotionQueryService.loadIndex(now);
        List<RankingCandidate> candidates = productRankingRepository.findTopCandidates(categoryId, limit * CANDIDATE_MULTIPLIER);
        Optional<ExposureSlot> previousSlot = exposureSlotRepository.findByContextKeyAndUserKey(slotKey, userKey);
        Set<Long> previouslyShown = previousSlot.map(this::readPreviousMix).orElse(Set.of());

        Map<Long, Integer> stocks = new HashMap<>();
        ToIntFunction<Long> stockLookup = productId -> stocks.computeIfAbsent(productId,
            id -> financialMetricsReader.getFinancialMetrics(id).stockOnHand());

        List<ExposureItem> mix = new ExposureSelector(exposureProperties.toPolicy())
            .select(candidates, previouslyShown, limit, stockLookup, promotions, userId);

        OffsetDateTime generatedAt = now.toOffsetDateTime();
        OffsetDateTime expiresAt = generatedAt.plus(exposureProperties.cache().ttl());
        ExposureResponse response = new ExposureResponse(context, userId, categoryId, generatedAt, expiresAt, mix);

        String payloadJson = writePayload(response);
        ExposureSlot slot = previousSlot
            .map(existing -> {
                existing.overwrite(payloadJson, generatedAt.toZonedDateTime(), expiresAt.toZonedDateTime());
                return existing;
            })
            .orElseGet(() -> ExposureSlot.of(slotKey, userId, payloadJson, generatedAt.toZonedDateTime(), expiresAt.toZonedDateTime()));
        exposureSlotRepository.save(slot);

        writeThroughAfterCommit(ExposureKeys.cacheKey(context, userId, categoryId), response, expiresAt.toInstant());

        engineMetrics.recordBuild(sample);
        log.debug("노출 구성 완료: slotKey={}, userKey={}, candidates={}, previouslyShown={}, selected={}",
            slotKey, userKey, candidates.size(), previouslyShown.size(), mix.size());
        return response;
    }

    /**
     * 슬롯 저장이 커밋된 뒤에만 캐시에 기록합니다. 트랜잭션 밖에서 호출되면 바로 기록합니다.
     */
    private void writeThroughAfterCommit(String cacheKey, ExposureResponse response, Instant expiresAt) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            exposureCache.set(cacheKey, response, expiresAt);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                exposureCache.set(cacheKey, response, expiresAt);
            }
        });
    }

    private Set<Long> readPreviousMix(ExposureSlot slot) {
        try {
            return objectMapper.readValue(slot.getPayloadJson(), ExposureResponse.class).productIds();
        } catch (JsonProcessingException e) {
            log.warn("직전 노출 슬롯 해석 실패, 반복 회피 없이 구성: contextKey={}, userKey={}",
                slot.getContextKey(), slot.getUserKey());
            return Set.of();
        }
    }

    private String writePayload(ExposureResponse response) {
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new CoreException(ErrorType.INTERNAL_ERROR, "노출 결과를 직렬화할 수 없습니다.");
        }
    }
}
