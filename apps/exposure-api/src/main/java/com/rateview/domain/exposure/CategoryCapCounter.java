package com.rateview.domain.exposure;

import java.util.HashMap;
import java.util.Map;

/**
 * 카테고리별 선택 수 카운터.
 * <p>
 * 한 번의 노출 구성 동안 세 단계(신규 선택, 보충, 콜드 부스트)가 같은 인스턴스를 공유합니다.
 * 카테고리가 없는 상품은 하나의 그룹(null)으로 셉니다.
 * </p>
 */
public class CategoryCapCounter {

    private final int cap;
    private final Map<Long, Integer> counts = new HashMap<>();

    /**
     * @param cap 카테고리당 최대 수 (0 이하이면 제한 없음)
     */
    public CategoryCapCounter(int cap) {
        this.cap = cap;
    }

    public boolean hasRoom(Long categoryId) {
        return cap <= 0 || counts.getOrDefault(categoryId, 0) < cap;
    }

    public void increment(Long categoryId) {
        counts.merge(categoryId, 1, Integer::sum);
    }

    public int countOf(Long categoryId) {
        return counts.getOrDefault(categoryId, 0);
    }
}
