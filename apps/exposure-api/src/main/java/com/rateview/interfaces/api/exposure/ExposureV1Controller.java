package com.rateview.interfaces.api.exposure;

import com.rateview.application.exposure.ExposureResponse;
import com.rateview.application.exposure.ExposureService;
import com.rateview.interfaces.api.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 노출 구성 API v1 컨트롤러.
 * <p>
 * 화면 컨텍스트(home, category, personalized 등)별 노출 상품 구성을 제공합니다.
 * </p>
 *
 * @author Rateview
 * @version 1.0
 */
@RequiredArgsConstructor
@RestController
@RequestMapping("/exposure")
public class ExposureV1Controller {

    private final ExposureService exposureService;

    /**
     * 노출 구성을 조회합니다. 캐시가 유효하면 같은 결과를 그대로 반환합니다.
     *
     * @param context 화면 컨텍스트 (2~50자)
     * @param userId 사용자 ID (선택)
     * @param categoryId 카테고리 ID (선택)
     * @param limit 최대 항목 수 (1~50, 기본값: 12)
     * @return 노출 구성
     */
    @GetMapping
    public ApiResponse<ExposureResponse> getExposure(
        @RequestParam String context,
        @RequestParam(name = "user_id", required = false) String userId,
        @RequestParam(name = "category_id", required = false) Long categoryId,
        @RequestParam(required = false, defaultValue = "12") int limit
    ) {
        ExposureV1Dto.ExposureQuery query = new ExposureV1Dto.ExposureQuery(context, userId, categoryId, limit);
        return ApiResponse.success(
            exposureService.getExposure(query.context(), query.userId(), query.categoryId(), query.limit())
        );
    }

    /**
     * 캐시를 무시하고 노출 구성을 새로 만듭니다.
     */
    @PostMapping("/refresh")
    public ApiResponse<ExposureResponse> refreshExposure(
        @RequestParam String context,
        @RequestParam(name = "user_id", required = false) String userId,
        @RequestParam(name = "category_id", required = false) Long categoryId,
        @RequestParam(required = false, defaultValue = "12") int limit
    ) {
        ExposureV1Dto.ExposureQuery query = new ExposureV1Dto.ExposureQuery(context, userId, categoryId, limit);
        return ApiResponse.success(
            exposureService.refreshExposure(query.context(), query.userId(), query.categoryId(), query.limit())
        );
    }

    /**
     * 노출 캐시와 슬롯을 무효화합니다. context가 없으면 전체를 무효화합니다.
     */
    @DeleteMapping("/cache")
    public ApiResponse<ExposureV1Dto.CacheClearResponse> clearCache(
        @RequestParam(required = false) String context,
        @RequestParam(name = "user_id", required = false) String userId,
        @RequestParam(name = "category_id", required = false) Long categoryId
    ) {
        if (context != null) {
            ExposureV1Dto.validateContext(context);
        }
        String normalizedUserId = userId == null || userId.isBlank() ? null : userId;
        return ApiResponse.success(
            ExposureV1Dto.CacheClearResponse.from(exposureService.clearCache(context, normalizedUserId, categoryId))
        );
    }
}
