package com.searchgate.dispatcher.metrics;

import lombok.Builder;
import lombok.Value;

/**
 * 一段时间内的调用计数。
 */
@Value
@Builder
public class RequestStats {

    long totalRequests;
    long successCount;
    long errorCount;
    long quotaExhaustedCount;
    Long lastActivity;
}
