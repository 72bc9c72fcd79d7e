package com.searchgate.dispatcher.metrics;

import com.searchgate.common.exception.InvalidRequestException;
import com.searchgate.common.exception.NotFoundException;
import com.searchgate.common.util.SensitiveDataRedactor;
import com.searchgate.data.entity.ResultStatus;
import com.searchgate.data.entity.TokenUsageStatEntity;
import com.searchgate.data.repository.RequestLogFilter;
import com.searchgate.data.repository.RequestLogRepository;
import com.searchgate.data.repository.TokenUsageStatRepository;
import com.searchgate.data.repository.UsageBucket;
import com.searchgate.dispatcher.audit.AuditLogService;
import com.searchgate.dispatcher.audit.LogView;
import com.searchgate.dispatcher.config.DispatcherProperties;
import com.searchgate.dispatcher.pool.ApiKeyPool;
import com.searchgate.dispatcher.pool.KeyPoolStats;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 用量统计：控制台汇总、Key / 令牌指标、小时桶与自定义粒度的用量序列、公开指标。
 */
@Service
@RequiredArgsConstructor
public class UsageMetricsService {

    private static final long HOUR = 3600;
    private static final int MAX_HOURS = 24 * 31;
    private static final int MAX_SERIES_BUCKETS = 2000;
    private static final int MAX_PUBLIC_LOGS = 20;

    private final RequestLogRepository logRepository;
    private final TokenUsageStatRepository statRepository;
    private final ApiKeyPool keyPool;
    private final AuditLogService auditLogService;
    private final DispatcherProperties properties;
    private final Clock clock;

    public DashboardSummary summary() {
        RequestStats stats = stats(RequestLogFilter.none());
        KeyPoolStats keys = keyPool.stats();
        return DashboardSummary.builder()
                .totalRequests(stats.getTotalRequests())
                .successCount(stats.getSuccessCount())
                .errorCount(stats.getErrorCount())
                .quotaExhaustedCount(stats.getQuotaExhaustedCount())
                .activeKeys(keys.getActiveKeys())
                .exhaustedKeys(keys.getExhaustedKeys())
                .disabledKeys(keys.getDisabledKeys())
                .lastActivity(stats.getLastActivity())
                .totalQuotaLimit(keys.getTotalQuotaLimit())
                .totalQuotaRemaining(keys.getTotalQuotaRemaining())
                .auditDegraded(auditLogService.isDegraded())
                .build();
    }

    /**
     * 单个 Key 自 since 以来的调用统计；since 为空时取 period 的起点。
     */
    public RequestStats keyMetrics(String keyId, Long since, String period) {
        if (keyPool.findKey(keyId).isEmpty()) {
            throw new NotFoundException("Key 不存在: " + keyId);
        }
        long from = since != null ? since : MetricsPeriod.parse(period).start(now(), properties.zoneId());
        return stats(RequestLogFilter.builder().keyId(keyId).since(from).build());
    }

    /**
     * 令牌在 [since, until) 内的调用统计，缺省区间为 period 所在的完整周期。
     */
    public RequestStats tokenMetrics(String tokenId, Long since, Long until, String period) {
        MetricsPeriod p = MetricsPeriod.parse(period);
        long from = since != null ? since : p.start(now(), properties.zoneId());
        long to = until != null ? until : p.end(from, properties.zoneId());
        if (to <= from) {
            throw new InvalidRequestException("until 必须晚于 since");
        }
        return stats(RequestLogFilter.builder().authTokenId(tokenId).since(from).until(to).build());
    }

    /**
     * 令牌最近 hours 个小时的用量，每小时一个桶（含当前小时），无数据的桶计数为 0。
     */
    public List<UsageBucket> tokenHourlyBuckets(String tokenId, int hours) {
        int n = Math.max(1, Math.min(MAX_HOURS, hours));
        long currentHour = floor(now(), HOUR);
        long since = currentHour - (n - 1) * HOUR;
        List<UsageBucket> rows = logRepository.aggregateBuckets(
                RequestLogFilter.builder().authTokenId(tokenId).since(since).build(), HOUR);
        return fill(rows, since, currentHour + HOUR, HOUR);
    }

    /**
     * 基于小时汇总表的用量序列。bucketSecs 必须是 3600 的正整数倍。
     */
    public List<UsageBucket> tokenUsageSeries(String tokenId, long since, long until, long bucketSecs) {
        if (until <= since) {
            throw new InvalidRequestException("until 必须晚于 since");
        }
        if (bucketSecs <= 0 || bucketSecs % HOUR != 0) {
            throw new InvalidRequestException("bucket_secs 必须是 3600 的正整数倍");
        }
        long start = floor(since, bucketSecs);
        if ((until - start) / bucketSecs > MAX_SERIES_BUCKETS) {
            throw new InvalidRequestException("时间范围过大，请增大 bucket_secs");
        }
        Map<Long, UsageBucket> merged = new TreeMap<>();
        for (TokenUsageStatEntity stat : statRepository.findRange(tokenId, start, until)) {
            long bucket = floor(stat.getBucketStart(), bucketSecs);
            UsageBucket acc = merged.computeIfAbsent(bucket, b -> new UsageBucket(b, 0, 0, 0));
            acc.setSuccessCount(acc.getSuccessCount() + nz(stat.getSuccessCount()));
            acc.setSystemFailureCount(acc.getSystemFailureCount() + nz(stat.getSystemFailureCount()));
            acc.setExternalFailureCount(acc.getExternalFailureCount() + nz(stat.getExternalFailureCount()));
        }
        return fill(new ArrayList<>(merged.values()), start, until, bucketSecs);
    }

    public PublicMetrics publicMetrics() {
        return successTotals(null);
    }

    public PublicMetrics tokenPublicMetrics(String tokenId) {
        return successTotals(tokenId);
    }

    /** 令牌持有者查看自己最近的日志，最多 20 条 */
    public List<PublicLogView> publicLogs(String tokenId, int limit) {
        int n = Math.max(1, Math.min(MAX_PUBLIC_LOGS, limit));
        return auditLogService.recent(RequestLogFilter.builder().authTokenId(tokenId).build(), n)
                .stream().map(UsageMetricsService::toPublic).collect(Collectors.toList());
    }

    // ==================== 内部方法 ====================

    private RequestStats stats(RequestLogFilter filter) {
        Map<ResultStatus, Long> counts = logRepository.countByResult(filter);
        long success = counts.getOrDefault(ResultStatus.SUCCESS, 0L);
        long error = counts.getOrDefault(ResultStatus.ERROR, 0L);
        long quota = counts.getOrDefault(ResultStatus.QUOTA_EXHAUSTED, 0L);
        return RequestStats.builder()
                .totalRequests(success + error + quota)
                .successCount(success)
                .errorCount(error)
                .quotaExhaustedCount(quota)
                .lastActivity(logRepository.findLastActivity(filter))
                .build();
    }

    private PublicMetrics successTotals(String tokenId) {
        long now = now();
        long monthStart = MetricsPeriod.MONTH.start(now, properties.zoneId());
        long dayStart = MetricsPeriod.DAY.start(now, properties.zoneId());
        long monthly = logRepository.countByResult(RequestLogFilter.builder()
                .authTokenId(tokenId).resultStatus(ResultStatus.SUCCESS).since(monthStart).build())
                .getOrDefault(ResultStatus.SUCCESS, 0L);
        long daily = logRepository.countByResult(RequestLogFilter.builder()
                .authTokenId(tokenId).resultStatus(ResultStatus.SUCCESS).since(dayStart).build())
                .getOrDefault(ResultStatus.SUCCESS, 0L);
        return new PublicMetrics(monthly, daily);
    }

    private static List<UsageBucket> fill(List<UsageBucket> rows, long since, long until, long width) {
        Map<Long, UsageBucket> byStart = new TreeMap<>();
        for (UsageBucket row : rows) {
            byStart.put(row.getBucketStart(), row);
        }
        List<UsageBucket> out = new ArrayList<>();
        for (long b = since; b < until; b += width) {
            UsageBucket existing = byStart.get(b);
            out.add(existing != null ? existing : new UsageBucket(b, 0, 0, 0));
        }
        return out;
    }

    private static PublicLogView toPublic(LogView log) {
        return PublicLogView.builder()
                .id(log.getId())
                .method(log.getMethod())
                .path(log.getPath())
                .query(SensitiveDataRedactor.redact(log.getQuery()))
                .httpStatus(log.getHttpStatus())
                .upstreamStatus(log.getUpstreamStatus())
                .resultStatus(log.getResultStatus())
                .errorMessage(SensitiveDataRedactor.redact(log.getErrorMessage()))
                .createdAt(log.getCreatedAt())
                .build();
    }

    private static long floor(long value, long width) {
        return Math.floorDiv(value, width) * width;
    }

    private static long nz(Long value) {
        return value == null ? 0L : value;
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
