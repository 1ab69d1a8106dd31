package com.rateview.interfaces.api.scoring;

import com.rateview.application.scoring.ScoringService;
import com.rateview.interfaces.api.ApiResponse;
import com.rateview.support.error.CoreException;
import com.rateview.support.error.ErrorType;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 점수 계산 내부 API v1 컨트롤러.
 *
 * @author Rateview
 * @version 1.0
 */
@RequiredArgsConstructor
@RestController
@RequestMapping("/internal/scoring")
public class ScoringV1Controller {

    private static final int MAX_RANKING_LIMIT = 100;

    private final ScoringService scoringService;

    /**
     * 점수 계산을 동기 실행합니다.
     *
     * @param windowDays 집계 구간(일, 선택). 없으면 설정값을 사용합니다.
     * @return 실행 결과
     */
    @PostMapping("/run")
    public ApiResponse<ScoringV1Dto.RunResponse> runScoring(
        @RequestParam(name = "window_days", required = false) Integer windowDays
    ) {
        return ApiResponse.success(ScoringV1Dto.RunResponse.from(
            windowDays == null ? scoringService.runScoring() : scoringService.runScoring(windowDays)
        ));
    }

    /**
     * exposure_score 상위 랭킹을 조회합니다.
     *
     * @param limit 최대 개수 (1~100, 기본값: 20)
     */
    @GetMapping("/rankings")
    public ApiResponse<List<ScoringV1Dto.RankingResponse>> getRankings(
        @RequestParam(required = false, defaultValue = "20") int limit
    ) {
        if (limit < 1 || limit > MAX_RANKING_LIMIT) {
            throw new CoreException(ErrorType.BAD_REQUEST,
                String.format("limit는 1 이상 %d 이하여야 합니다. (limit: %d)", MAX_RANKING_LIMIT, limit));
        }
        return ApiResponse.success(scoringService.getLatestRankings(limit).stream()
            .map(ScoringV1Dto.RankingResponse::from)
            .toList());
    }
}
