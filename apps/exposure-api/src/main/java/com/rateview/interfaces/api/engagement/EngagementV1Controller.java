package com.rateview.interfaces.api.engagement;

import com.rateview.application.engagement.EngagementService;
import com.rateview.domain.engagement.EngagementEvent;
import com.rateview.interfaces.api.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * 참여 이벤트 API v1 컨트롤러.
 * <p>
 * 프런트엔드 트래커와 결제 백엔드가 보내는 참여 이벤트를 수집하고 일별 집계를 조회합니다.
 * </p>
 *
 * @author Rateview
 * @version 1.0
 */
@RequiredArgsConstructor
@RestController
@RequestMapping("/events")
public class EngagementV1Controller {

    private final EngagementService engagementService;
    private final Clock clock;

    /**
     * 참여 이벤트를 수집합니다.
     *
     * @param request 이벤트 요청
     * @return 반영 후 당일 상품 집계 (중복이면 accepted=false)
     */
    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public ApiResponse<EngagementV1Dto.EventResponse> ingestEvent(
        @Valid @RequestBody EngagementV1Dto.EventRequest request
    ) {
        EngagementEvent event = request.toEvent(clock.instant());
        return ApiResponse.success(
            EngagementV1Dto.EventResponse.from(engagementService.recordEvent(event), event)
        );
    }

    /**
     * 상품 일별 집계를 조회합니다.
     *
     * @param productId 상품 ID
     * @param day 특정 일자 (yyyy-MM-dd, 선택)
     */
    @GetMapping("/products/{productId}")
    public ApiResponse<List<EngagementV1Dto.ProductEngagementResponse>> getProductEngagement(
        @PathVariable Long productId,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate day
    ) {
        return ApiResponse.success(engagementService.getProductEngagement(productId, day).stream()
            .map(EngagementV1Dto.ProductEngagementResponse::from)
            .toList());
    }

    /**
     * 고객 일별 집계를 조회합니다.
     *
     * @param userId 고객 ID
     * @param day 특정 일자 (yyyy-MM-dd, 선택)
     */
    @GetMapping("/customers/{userId}")
    public ApiResponse<List<EngagementV1Dto.CustomerEngagementResponse>> getCustomerEngagement(
        @PathVariable String userId,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate day
    ) {
        return ApiResponse.success(engagementService.getCustomerEngagement(userId, day).stream()
            .map(EngagementV1Dto.CustomerEngagementResponse::from)
            .toList());
    }
}
