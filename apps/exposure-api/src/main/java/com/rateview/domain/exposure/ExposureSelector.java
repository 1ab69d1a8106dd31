package com.rateview.domain.exposure;

import com.rateview.domain.promotion.ActivePromotion;
import com.rateview.domain.promotion.PromotionIndex;
import com.rateview.domain.ranking.RankingCandidate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.ToIntFunction;

/**
 * 노출 구성 선택기.
 * <p>
 * 랭킹 순서의 후보 목록에서 세 단계로 노출 항목을 고릅니다.
 * <ol>
 *   <li><b>신규 선택</b>: 카테고리 상한을 먼저 확인하고, 직전 노출 상품은 건너뛰어 보충 후보로 남깁니다. limit에 도달하면 멈춥니다.</li>
 *   <li><b>보충</b>: 부족하면 직전 노출 상품을 같은 상한 규칙으로 다시 시도합니다.</li>
 *   <li><b>콜드 부스트</b>: 신규 선택 단계에서 검토한 후보를 cold_score 내림차순(안정 정렬)으로 보고,
 *       cold_score와 재고가 임계값 이상이며 상한 여유가 있으면 추가합니다.</li>
 * </ol>
 * 세 단계는 하나의 {@link CategoryCapCounter}를 공유하므로 반드시 이 순서로 실행합니다.
 * 입력이 같으면 결과도 같습니다.
 * </p>
 *
 * @author Rateview
 * @version 1.0
 */
public class ExposureSelector {

    private static final String IN_STOCK = "in_stock";
    private static final String FRESH = "fresh";
    private static final String PROMO_BADGE = "promo";

    private final ExposurePolicy policy;

    public ExposureSelector(ExposurePolicy policy) {
        this.policy = policy;
    }

    /**
     * 노출 항목을 선택합니다.
     *
     * @param candidates exposure_score 내림차순, product_id 오름차순 후보
     * @param previouslyShown 직전 노출 상품 ID
     * @param limit 최대 항목 수
     * @param stockLookup 상품 재고 조회 (실패 시 0)
     * @param promotions 프로모션 인덱스
     * @param userId 요청 사용자 ID (익명이면 null)
     * @return 최대 limit개의 노출 항목
     */
    public List<ExposureItem> select(
        List<RankingCandidate> candidates,
        Set<Long> previouslyShown,
        int limit,
        ToIntFunction<Long> stockLookup,
        PromotionIndex promotions,
        String userId
    ) {
        CategoryCapCounter capCounter = new CategoryCapCounter(policy.categoryCap());
        List<ExposureItem> selected = new ArrayList<>();
        Set<Long> selectedIds = new HashSet<>();
        List<RankingCandidate> skippedForRepeat = new ArrayList<>();
        List<RankingCandidate> considered = new ArrayList<>();

        // 신규 선택
        for (RankingCandidate candidate : candidates) {
            if (selected.size() >= limit) {
                break;
            }
            if (!capCounter.hasRoom(candidate.categoryId())) {
                continue;
            }
            considered.add(candidate);
            if (previouslyShown.contains(candidate.productId())) {
                skippedForRepeat.add(candidate);
                continue;
            }
            add(candidate, false, stockLookup.applyAsInt(candidate.productId()), promotions, userId, selected, selectedIds, capCounter);
        }

        // 보충
        for (RankingCandidate candidate : skippedForRepeat) {
            if (selected.size() >= limit) {
                break;
            }
            if (!capCounter.hasRoom(candidate.categoryId())) {
                continue;
            }
            add(candidate, false, stockLookup.applyAsInt(candidate.productId()), promotions, userId, selected, selectedIds, capCounter);
        }

        // 콜드 부스트
        List<RankingCandidate> coldOrdered = considered.stream()
            .sorted(Comparator.comparingDouble(RankingCandidate::coldScore).reversed())
            .toList();
        for (RankingCandidate candidate : coldOrdered) {
            if (selected.size() >= limit) {
                break;
            }
            if (selectedIds.contains(candidate.productId())
                || candidate.coldScore() < policy.coldThreshold()
                || !capCounter.hasRoom(candidate.categoryId())) {
                continue;
            }
            int stock = stockLookup.applyAsInt(candidate.productId());
            if (stock < policy.stockThreshold()) {
                continue;
            }
            add(candidate, true, stock, promotions, userId, selected, selectedIds, capCounter);
        }

        return selected.size() > limit ? List.copyOf(selected.subList(0, limit)) : List.copyOf(selected);
    }

    private void add(
        RankingCandidate candidate,
        boolean coldBoost,
        int stock,
        PromotionIndex promotions,
        String userId,
        List<ExposureItem> selected,
        Set<Long> selectedIds,
        CategoryCapCounter capCounter
    ) {
        Optional<ActivePromotion> promotion = promotions.resolve(candidate.productId(), candidate.categoryId(), userId);
        selected.add(buildItem(candidate, stock, promotion, coldBoost));
        selectedIds.add(candidate.productId());
        capCounter.increment(candidate.categoryId());
    }

    ExposureItem buildItem(RankingCandidate candidate, int stock, Optional<ActivePromotion> promotion, boolean coldBoost) {
        List<String> reasons = new ArrayList<>();
        List<String> badges = new ArrayList<>();

        if (candidate.popularityScore() >= ExposurePolicy.POPULAR_THRESHOLD) {
            reasons.add(policy.popularReason());
        }
        if (stock >= policy.stockThreshold()) {
            reasons.add(IN_STOCK);
        }
        if (coldBoost && candidate.coldScore() >= policy.coldThreshold()) {
            reasons.add(policy.coldBoostReason());
        }
        if (candidate.freshnessScore() >= policy.freshnessThreshold()) {
            reasons.add(FRESH);
        }
        promotion.ifPresent(active -> {
            badges.add(PROMO_BADGE);
            reasons.add(active.reason());
        });

        return new ExposureItem(candidate.productId(), reasons, badges);
    }
}
