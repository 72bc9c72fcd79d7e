package com.searchgate.web.dto;

import com.searchgate.dispatcher.metrics.PublicMetrics;
import com.searchgate.dispatcher.quota.QuotaVerdict;
import com.searchgate.dispatcher.quota.WindowUsage;
import lombok.Builder;
import lombok.Value;

/**
 * 令牌持有者自查用量：成功次数与三个配额窗口。
 */
@Value
@Builder
public class TokenUsageResponse {

    String tokenId;
    long monthlySuccess;
    long dailySuccess;
    String quotaState;
    WindowUsage hourly;
    WindowUsage daily;
    WindowUsage monthly;

    public static TokenUsageResponse of(String tokenId, PublicMetrics metrics, QuotaVerdict quota) {
        return TokenUsageResponse.builder()
                .tokenId(tokenId)
                .monthlySuccess(metrics.getMonthlySuccess())
                .dailySuccess(metrics.getDailySuccess())
                .quotaState(quota.quotaState())
                .hourly(quota.getHourly())
                .daily(quota.getDaily())
                .monthly(quota.getMonthly())
                .build();
    }
}
