package com.rateview.application.exposure;

import com.rateview.config.ExposureProperties;
import com.rateview.domain.exposure.ExposureKeys;
import com.rateview.domain.exposure.ExposureSlotRepository;
import com.rateview.support.concurrency.SingleFlight;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * 노출 조회 파사드.
 * <p>
 * HTTP 계층이 사용하는 유일한 진입점입니다. 캐시 적중 시 캐시 값을 그대로 반환하고,
 * 미스 시 키별 단일 실행으로 {@link ExposureBuilder}를 호출합니다.
 * 같은 키에 대한 동시 미스는 한 번만 구성하고 나머지는 그 결과를 받습니다.
 * </p>
 *
 * @author Rateview
 * @version 1.0
 */
@Slf4j
@Service
public class ExposureService {

    private final ExposureBuilder exposureBuilder;
    private final ExposureCache exposureCache;
    private final ExposureSlotRepository exposureSlotRepository;
    private final SingleFlight<String, ExposureResponse> singleFlight;

    public ExposureService(
        ExposureBuilder exposureBuilder,
        ExposureCache exposureCache,
        ExposureSlotRepository exposureSlotRepository,
        ExposureProperties exposureProperties
    ) {
        this.exposureBuilder = exposureBuilder;
        this.exposureCache = exposureCache;
        this.exposureSlotRepository = exposureSlotRepository;
        this.singleFlight = new SingleFlight<>(exposureProperties.buildWaitTimeout());
    }

    /**
     * 노출 구성을 조회합니다. 캐시 미스 시 새로 구성합니다.
     */
    public ExposureResponse getExposure(String context, String userId, Long categoryId, int limit) {
        String cacheKey = ExposureKeys.cacheKey(context, userId, categoryId);
        Optional<ExposureResponse> cached = exposureCache.get(cacheKey);
        if (cached.isPresent()) {
            log.debug("노출 캐시 적중: key={}", cacheKey);
            return cached.get();
        }
        // 미스 이후 앞선 구성이 끝났을 수 있으므로 단일 실행 안에서 캐시를 다시 확인한다
        return singleFlight.execute(cacheKey, () -> exposureCache.peek(cacheKey)
            .orElseGet(() -> exposureBuilder.buildExposure(context, userId, categoryId, limit)));
    }

    /**
     * 캐시를 무시하고 노출 구성을 강제로 새로 만듭니다.
     */
    public ExposureResponse refreshExposure(String context, String userId, Long categoryId, int limit) {
        String cacheKey = ExposureKeys.cacheKey(context, userId, categoryId);
        log.info("노출 강제 갱신: key={}", cacheKey);
        return singleFlight.execute(cacheKey, () -> exposureBuilder.buildExposure(context, userId, categoryId, limit));
    }

    /**
     * 캐시와 노출 슬롯을 함께 무효화합니다.
     * <p>
     * context가 없으면 모든 캐시와 슬롯을 삭제하고, 있으면 해당 키의 캐시 엔트리와 슬롯만 삭제합니다.
     * </p>
     *
     * @return 무효화 범위와 삭제된 슬롯 수
     */
    @Transactional
    public CacheClearResult clearCache(String context, String userId, Long categoryId) {
        if (context == null) {
            exposureCache.clear();
            long deleted = exposureSlotRepository.deleteAll();
            log.info("노출 캐시/슬롯 전체 삭제: slotsDeleted={}", deleted);
            return new CacheClearResult(CacheClearResult.ALL, deleted);
        }

        String cacheKey = ExposureKeys.cacheKey(context, userId, categoryId);
        exposureCache.clear(cacheKey);
        long deleted = exposureSlotRepository.deleteByContextKeyAndUserKey(
            ExposureKeys.slotKey(context, categoryId), ExposureKeys.userKey(userId));
        log.info("노출 캐시/슬롯 삭제: key={}, slotsDeleted={}", cacheKey, deleted);
        return new CacheClearResult(cacheKey, deleted);
    }

    /**
     * 빌드 진행 상태 (운영 확인용).
     */
    public SingleFlight.BuildState buildStateOf(String context, String userId, Long categoryId) {
        return singleFlight.stateOf(ExposureKeys.cacheKey(context, userId, categoryId));
    }

    /**
     * 캐시 무효화 결과.
     *
     * @param cleared 무효화한 캐시 키 ({@code *}이면 전체)
     * @param slotsDeleted 삭제된 슬롯 수
     */
    public record CacheClearResult(String cleared, long slotsDeleted) {
        public static final String ALL = "*";
    }
}
