package com.searchgate.dispatcher.metrics;

import lombok.Builder;
import lombok.Value;

/**
 * 控制台汇总指标。
 */
@Value
@Builder
public class DashboardSummary {

    long totalRequests;
    long successCount;
    long errorCount;
    long quotaExhaustedCount;
    long activeKeys;
    long exhaustedKeys;
    long disabledKeys;
    Long lastActivity;
    long totalQuotaLimit;
    long totalQuotaRemaining;

    /** 审计日志最近一次写入失败 */
    boolean auditDegraded;
}
