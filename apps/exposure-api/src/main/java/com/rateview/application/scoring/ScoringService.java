package com.rateview.application.scoring;

import com.rateview.application.metrics.EngineMetrics;
import com.rateview.config.ExposureProperties;
import com.rateview.config.ScoringProperties;
import com.rateview.domain.catalog.FinancialMetrics;
import com.rateview.domain.catalog.FinancialMetricsReader;
import com.rateview.domain.engagement.EngagementDaily;
import com.rateview.domain.engagement.EngagementDailyRepository;
import com.rateview.domain.ranking.DecayedEngagement;
import com.rateview.domain.ranking.ExposureScoreCalculator;
import com.rateview.domain.ranking.HalfLifeDecay;
import com.rateview.domain.ranking.ProductRanking;
import com.rateview.domain.ranking.ProductRankingRepository;
import com.rateview.domain.ranking.RankingScores;
import com.rateview.domain.ranking.RawSignals;
import com.rateview.support.error.CoreException;
import com.rateview.support.error.ErrorType;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 감쇠 기반 점수 계산 서비스.
 * <p>
 * 최근 {@code windowDays}일의 상품 일별 집계를 읽어 반감기 감쇠를 적용하고,
 * 인기도/수익성/콜드/신선도 신호를 이번 실행 후보군 기준으로 정규화하여 {@link ProductRanking}을 갱신합니다.
 * </p>
 * <p>
 * <b>실행 규칙:</b>
 * <ul>
 *   <li>실행은 프로세스 내 락으로 직렬화합니다. 겹치는 호출은 앞선 실행이 끝날 때까지 기다립니다.</li>
 *   <li>상품 단위 실패(재무 지표 조회 실패 등)는 0 값으로 대체하고 계속 진행합니다.</li>
 *   <li>전체를 하나의 트랜잭션으로 묶지 않습니다. 중간에 중단되면 일부만 갱신되며, 재실행은 멱등입니다.</li>
 *   <li>스레드 인터럽트는 상품 사이에서만 확인하며, 그 시점까지의 결과를 반환합니다.</li>
 *   <li>구간 내 집계가 없는 상품은 기존 랭킹을 그대로 둡니다.</li>
 * </ul>
 * </p>
 *
 * @author Rateview
 * @version 1.0
 */
@Slf4j
@Service
public class ScoringService {

    private final EngagementDailyRepository engagementDailyRepository;
    private final ProductRankingRepository productRankingRepository;
    private final FinancialMetricsReader financialMetricsReader;
    private final EngineMetrics engineMetrics;
    private final ExposureProperties exposureProperties;
    private final ScoringProperties scoringProperties;
    private final Clock clock;
    private final ReentrantLock runLock = new ReentrantLock();

    public ScoringService(
        EngagementDailyRepository engagementDailyRepository,
        ProductRankingRepository productRankingRepository,
        FinancialMetricsReader financialMetricsReader,
        EngineMetrics engineMetrics,
        ExposureProperties exposureProperties,
        ScoringProperties scoringProperties,
        Clock clock
    ) {
        this.engagementDailyRepository = engagementDailyRepository;
        this.productRankingRepository = productRankingRepository;
        this.financialMetricsReader = financialMetricsReader;
        this.engineMetrics = engineMetrics;
        this.exposureProperties = exposureProperties;
        this.scoringProperties = scoringProperties;
        this.clock = clock;
    }

    /**
     * 설정된 기본 구간으로 점수를 계산합니다.
     */
    public ScoringResult runScoring() {
        return runScoring(scoringProperties.windowDays());
    }

    /**
     * 점수를 계산하고 랭킹을 갱신합니다.
     *
     * @param windowDays 집계 구간(일, 1 이상)
     * @return 실행 결과
     * @throws CoreException windowDays가 1 미만인 경우 BAD_REQUEST
     */
    public ScoringResult runScoring(int windowDays) {
        if (windowDays < 1) {
            throw new CoreException(ErrorType.BAD_REQUEST, "집계 구간은 1일 이상이어야 합니다.");
        }

        runLock.lock();
        try {
            Timer.Sample sample = engineMetrics.startSample();
            ScoringResult result = score(windowDays);
            engineMetrics.recordScoringRun(sample);
            engineMetrics.recordProductsUpdated(result.count());
            log.info("점수 계산 완료: windowDays={}, updated={}", windowDays, result.count());
            return result;
        } finally {
            runLock.unlock();
        }
    }

    /**
     * exposure_score 상위 랭킹을 조회합니다.
     *
     * @param limit 최대 개수
     */
    @Transactional(readOnly = true)
    public List<ProductRanking> getLatestRankings(int limit) {
        return productRankingRepository.findTopByExposureScore(limit);
    }

    private ScoringResult score(int windowDays) {
        LocalDate today = LocalDate.now(clock);
        List<EngagementDaily> rows = engagementDailyRepository.findAllSince(today.minusDays(windowDays - 1L));

        HalfLifeDecay decay = new HalfLifeDecay(scoringProperties.halfLifeDays());
        HalfLifeDecay freshnessDecay = new HalfLifeDecay(scoringProperties.freshnessHalfLife());

        Map<Long, DecayedEngagement> byProduct = new TreeMap<>();
        for (EngagementDaily row : rows) {
            double ageDays = Math.max(0L, ChronoUnit.DAYS.between(row.getStatDate(), today));
            byProduct.computeIfAbsent(row.getProductId(), DecayedEngagement::new)
                .accumulate(row, ageDays, decay, freshnessDecay);
        }

        List<RawSignals> signals = new ArrayList<>();
        for (DecayedEngagement engagement : byProduct.values()) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("점수 계산 중단 요청, 재무 지표 조회 중단: collected={}", signals.size());
                break;
            }
            signals.add(RawSignals.of(engagement, lookupFinancialMetrics(engagement.getProductId())));
        }

        List<RankingScores> scores = new ExposureScoreCalculator(
            exposureProperties.popularityWeight(),
            exposureProperties.strategicWeight()
        ).calculate(signals);

        ZonedDateTime now = ZonedDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
        List<Long> updated = new ArrayList<>();
        for (RankingScores score : scores) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("점수 계산 중단 요청, 부분 결과 반환: updated={}, remaining={}",
                    updated.size(), scores.size() - updated.size());
                break;
            }
            upsert(score, now);
            updated.add(score.productId());
        }
        return ScoringResult.of(updated, windowDays);
    }

    private FinancialMetrics lookupFinancialMetrics(Long productId) {
        try {
            return financialMetricsReader.getFinancialMetrics(productId);
        } catch (RuntimeException e) {
            log.warn("재무 지표 조회 실패, 0 값으로 대체: productId={}, error={}", productId, e.getMessage());
            return FinancialMetrics.empty();
        }
    }

    private void upsert(RankingScores score, ZonedDateTime now) {
        ProductRanking ranking = productRankingRepository.findByProductId(score.productId())
            .map(existing -> {
                existing.updateScores(score, now);
                return existing;
            })
            .orElseGet(() -> ProductRanking.of(score, now));
        productRankingRepository.save(ranking);
        log.debug("랭킹 갱신: productId={}, exposureScore={}", score.productId(), score.exposureScore());
    }
}
