package com.searchgate.dispatcher.pool;

import lombok.Builder;
import lombok.Value;

/**
 * Key 池状态汇总，配额合计只统计未删除的 Key。
 */
@Value
@Builder
public class KeyPoolStats {

    long activeKeys;
    long exhaustedKeys;
    long disabledKeys;
    long deletedKeys;
    long totalQuotaLimit;
    long totalQuotaRemaining;
}
