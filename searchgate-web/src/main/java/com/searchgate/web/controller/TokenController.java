package com.searchgate.web.controller;

import com.searchgate.common.dto.ApiResponse;
import com.searchgate.common.dto.PageResult;
import com.searchgate.common.exception.InvalidRequestException;
import com.searchgate.data.repository.RequestLogFilter;
import com.searchgate.data.repository.UsageBucket;
import com.searchgate.dispatcher.audit.AuditLogService;
import com.searchgate.dispatcher.audit.LogQuery;
import com.searchgate.dispatcher.audit.LogView;
import com.searchgate.dispatcher.metrics.RequestStats;
import com.searchgate.dispatcher.metrics.UsageMetricsService;
import com.searchgate.dispatcher.realtime.SnapshotBroadcaster;
import com.searchgate.dispatcher.token.AuthTokenService;
import com.searchgate.dispatcher.token.CreateTokenCommand;
import com.searchgate.dispatcher.token.IssuedToken;
import com.searchgate.dispatcher.token.TokenGroupView;
import com.searchgate.dispatcher.token.TokenView;
import com.searchgate.web.config.WebProperties;
import com.searchgate.web.dto.BatchTokenRequest;
import com.searchgate.web.dto.CreateTokenRequest;
import com.searchgate.web.dto.NoteRequest;
import com.searchgate.web.dto.SecretResponse;
import com.searchgate.web.dto.StatusRequest;
import com.searchgate.web.sse.SseSnapshotListener;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Clock;
import java.util.List;

/**
 * 访问令牌管理与令牌维度的统计（仅管理员）。
 */
@RestController
@RequestMapping("/api/tokens")
@RequiredArgsConstructor
public class TokenController {

    private static final long HOUR = 3600;

    private final AuthTokenService tokenService;
    private final UsageMetricsService metricsService;
    private final AuditLogService auditLogService;
    private final SnapshotBroadcaster broadcaster;
    private final WebProperties properties;
    private final Clock clock;

    @GetMapping
    public ApiResponse<PageResult<TokenView>> list(
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "per_page", defaultValue = "10") int perPage,
            @RequestParam(value = "group", required = false) String group,
            @RequestParam(value = "no_group", defaultValue = "false") boolean noGroup) {
        return ApiResponse.ok(tokenService.list(page, perPage, group, noGroup));
    }

    @PostMapping
    public ApiResponse<IssuedToken> create(@RequestBody(required = false) CreateTokenRequest request) {
        CreateTokenRequest r = request == null ? new CreateTokenRequest() : request;
        return ApiResponse.ok(tokenService.create(CreateTokenCommand.builder()
                .note(r.getNote())
                .group(r.getGroup())
                .hourlyLimit(r.getHourlyLimit())
                .dailyLimit(r.getDailyLimit())
                .monthlyLimit(r.getMonthlyLimit())
                .build()));
    }

    @PostMapping("/batch")
    public ApiResponse<List<IssuedToken>> createBatch(@RequestBody BatchTokenRequest request) {
        if (request.getGroup() == null || request.getGroup().isBlank()) {
            throw new InvalidRequestException("批量创建需要指定分组");
        }
        return ApiResponse.ok(tokenService.createBatch(request.getGroup(), request.getCount(), request.getNote()));
    }

    @GetMapping("/groups")
    public ApiResponse<List<TokenGroupView>> groups() {
        return ApiResponse.ok(tokenService.groups());
    }

    @GetMapping("/{id}")
    public ApiResponse<TokenView> detail(@PathVariable("id") String id) {
        return ApiResponse.ok(tokenService.view(tokenService.findToken(id)));
    }

    /** 软删除 */
    @DeleteMapping("/{id}")
    public ApiResponse<Void> delete(@PathVariable("id") String id) {
        tokenService.delete(id);
        return ApiResponse.ok(null, "已删除");
    }

    @PatchMapping("/{id}/status")
    public ApiResponse<TokenView> updateStatus(@PathVariable("id") String id, @RequestBody StatusRequest request) {
        if (request.getEnabled() == null) {
            throw new InvalidRequestException("缺少 enabled 字段");
        }
        tokenService.updateStatus(id, request.getEnabled());
        return detail(id);
    }

    @PatchMapping("/{id}/note")
    public ApiResponse<TokenView> updateNote(@PathVariable("id") String id, @RequestBody NoteRequest request) {
        tokenService.updateNote(id, request.getNote());
        return detail(id);
    }

    @GetMapping("/{id}/secret")
    public ApiResponse<SecretResponse> secret(@PathVariable("id") String id) {
        return ApiResponse.ok(new SecretResponse(id, tokenService.revealToken(id)));
    }

    /**
     * 轮换密钥，旧令牌立即失效，用量不变。
     */
    @PostMapping("/{id}/secret/rotate")
    public ApiResponse<IssuedToken> rotate(@PathVariable("id") String id) {
        return ApiResponse.ok(tokenService.rotateSecret(id));
    }

    @GetMapping("/{id}/metrics")
    public ApiResponse<RequestStats> metrics(@PathVariable("id") String id,
                                             @RequestParam(value = "period", required = false) String period,
                                             @RequestParam(value = "since", required = false) String since,
                                             @RequestParam(value = "until", required = false) String until) {
        tokenService.findToken(id);
        return ApiResponse.ok(metricsService.tokenMetrics(id,
                TimeParams.parse(since, "since"), TimeParams.parse(until, "until"), period));
    }

    @GetMapping("/{id}/metrics/hourly")
    public ApiResponse<List<UsageBucket>> hourly(@PathVariable("id") String id,
                                                 @RequestParam(value = "hours", defaultValue = "25") int hours) {
        tokenService.findToken(id);
        return ApiResponse.ok(metricsService.tokenHourlyBuckets(id, hours));
    }

    @GetMapping("/{id}/metrics/usage-series")
    public ApiResponse<List<UsageBucket>> usageSeries(@PathVariable("id") String id,
                                                      @RequestParam(value = "since", required = false) String since,
                                                      @RequestParam(value = "until", required = false) String until,
                                                      @RequestParam(value = "bucket_secs", defaultValue = "3600") long bucketSecs) {
        tokenService.findToken(id);
        Long parsedUntil = TimeParams.parse(until, "until");
        long to = parsedUntil != null ? parsedUntil : clock.instant().getEpochSecond();
        Long parsedSince = TimeParams.parse(since, "since");
        long from = parsedSince != null ? parsedSince : to - 25 * HOUR;
        return ApiResponse.ok(metricsService.tokenUsageSeries(id, from, to, bucketSecs));
    }

    /**
     * 最近日志，before 为游标（不含）。
     */
    @GetMapping("/{id}/logs")
    public ApiResponse<List<LogView>> logs(@PathVariable("id") String id,
                                           @RequestParam(value = "limit", defaultValue = "20") int limit,
                                           @RequestParam(value = "before", required = false) Long before) {
        int n = Math.max(1, Math.min(AuditLogService.MAX_PER_PAGE, limit));
        return ApiResponse.ok(auditLogService.recent(
                RequestLogFilter.builder().authTokenId(id).build(), n, before));
    }

    @GetMapping("/{id}/logs/page")
    public ApiResponse<PageResult<LogView>> logsPage(@PathVariable("id") String id,
                                                     @RequestParam(value = "page", defaultValue = "1") int page,
                                                     @RequestParam(value = "per_page", defaultValue = "20") int perPage,
                                                     @RequestParam(value = "since", required = false) String since,
                                                     @RequestParam(value = "until", required = false) String until,
                                                     @RequestParam(value = "anchor_id", required = false) Long anchorId) {
        RequestLogFilter filter = RequestLogFilter.builder()
                .authTokenId(id)
                .since(TimeParams.parse(since, "since"))
                .until(TimeParams.parse(until, "until"))
                .build();
        return ApiResponse.ok(auditLogService.query(LogQuery.builder()
                .filter(filter).page(page).perPage(perPage).anchorId(anchorId).build()));
    }

    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@PathVariable("id") String id) {
        tokenService.findToken(id);
        return SseSnapshotListener.open(broadcaster, properties.getSseTimeoutMs(),
                listener -> broadcaster.subscribeToken(id, listener));
    }
}
