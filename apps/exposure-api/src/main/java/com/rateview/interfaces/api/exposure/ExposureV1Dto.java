package com.rateview.interfaces.api.exposure;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.rateview.application.exposure.ExposureService;
import com.rateview.support.error.CoreException;
import com.rateview.support.error.ErrorType;

/**
 * 노출 API v1의 데이터 전송 객체(DTO) 컨테이너.
 * <p>
 * 노출 구성 응답은 {@link com.rateview.application.exposure.ExposureResponse}를 그대로 사용합니다.
 * </p>
 *
 * @author Rateview
 * @version 1.0
 */
public class ExposureV1Dto {

    static final int MIN_CONTEXT_LENGTH = 2;
    static final int MAX_CONTEXT_LENGTH = 50;
    static final int MIN_LIMIT = 1;
    static final int MAX_LIMIT = 50;

    /**
     * 캐시 무효화 응답.
     *
     * @param status 처리 상태 (cleared)
     * @param cleared 무효화한 캐시 키 ({@code *}이면 전체)
     * @param slotsDeleted 삭제된 노출 슬롯 수
     */
    public record CacheClearResponse(
        @JsonProperty("status") String status,
        @JsonProperty("cleared") String cleared,
        @JsonProperty("slots_deleted") long slotsDeleted
    ) {
        public static CacheClearResponse from(ExposureService.CacheClearResult result) {
            return new CacheClearResponse("cleared", result.cleared(), result.slotsDeleted());
        }
    }

    /**
     * 노출 조회 파라미터.
     */
    public record ExposureQuery(String context, String userId, Long categoryId, int limit) {

        public ExposureQuery {
            validateContext(context);
            if (limit < MIN_LIMIT || limit > MAX_LIMIT) {
                throw new CoreException(ErrorType.BAD_REQUEST,
                    String.format("limit는 %d 이상 %d 이하여야 합니다. (limit: %d)", MIN_LIMIT, MAX_LIMIT, limit));
            }
            userId = userId == null || userId.isBlank() ? null : userId;
        }
    }

    static void validateContext(String context) {
        if (context == null || context.length() < MIN_CONTEXT_LENGTH || context.length() > MAX_CONTEXT_LENGTH) {
            throw new CoreException(ErrorType.BAD_REQUEST,
                String.format("context는 %d자 이상 %d자 이하여야 합니다.", MIN_CONTEXT_LENGTH, MAX_CONTEXT_LENGTH));
        }
    }
}
