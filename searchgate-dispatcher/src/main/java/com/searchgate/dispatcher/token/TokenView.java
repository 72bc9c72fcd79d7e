package com.searchgate.dispatcher.token;

import com.searchgate.dispatcher.quota.WindowUsage;
import lombok.Builder;
import lombok.Value;

/**
 * 令牌对外视图，不含密钥。
 */
@Value
@Builder
public class TokenView {

    String id;
    boolean enabled;
    String note;
    String group;
    long totalRequests;
    Long createdAt;
    Long lastUsedAt;
    String quotaState;
    WindowUsage hourly;
    WindowUsage daily;
    WindowUsage monthly;
}
