package com.searchgate.web.controller;

import com.searchgate.common.dto.ApiResponse;
import com.searchgate.common.exception.UnauthorizedException;
import com.searchgate.data.entity.AuthTokenEntity;
import com.searchgate.dispatcher.metrics.PublicLogView;
import com.searchgate.dispatcher.metrics.PublicMetrics;
import com.searchgate.dispatcher.metrics.UsageMetricsService;
import com.searchgate.dispatcher.quota.TokenQuotaTracker;
import com.searchgate.dispatcher.token.AuthTokenService;
import com.searchgate.web.dto.TokenUsageResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 无需管理员权限的只读接口。令牌可放在 Authorization 头或 token 查询参数里。
 */
@RestController
@RequiredArgsConstructor
public class PublicController {

    private final UsageMetricsService metricsService;
    private final AuthTokenService tokenService;
    private final TokenQuotaTracker quotaTracker;

    @GetMapping("/api/public/metrics")
    public ApiResponse<PublicMetrics> metrics() {
        return ApiResponse.ok(metricsService.publicMetrics());
    }

    @GetMapping("/api/public/logs")
    public ApiResponse<List<PublicLogView>> logs(
            @RequestParam(value = "token", required = false) String token,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestParam(value = "limit", defaultValue = "20") int limit) {
        AuthTokenEntity entity = tokenService.authenticate(resolveToken(token, authorization));
        return ApiResponse.ok(metricsService.publicLogs(entity.getTokenId(), limit));
    }

    @GetMapping("/api/token/metrics")
    public ApiResponse<TokenUsageResponse> tokenMetrics(
            @RequestParam(value = "token", required = false) String token,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        AuthTokenEntity entity = tokenService.authenticate(resolveToken(token, authorization));
        return ApiResponse.ok(TokenUsageResponse.of(entity.getTokenId(),
                metricsService.tokenPublicMetrics(entity.getTokenId()),
                quotaTracker.currentUsage(entity)));
    }

    private static String resolveToken(String query, String authorization) {
        String bearer = ProxyController.bearerToken(authorization);
        if (bearer != null) {
            return bearer;
        }
        if (query != null && !query.isBlank()) {
            return query.trim();
        }
        throw new UnauthorizedException("缺少访问令牌");
    }
}
