package com.searchgate.dispatcher.pool;

import com.searchgate.data.entity.ApiKeyEntity;
import lombok.Builder;
import lombok.Value;

/**
 * Key 对外视图，不含真实密钥。
 */
@Value
@Builder
public class KeyView {

    String id;
    String status;
    Long statusChangedAt;
    Long lastUsedAt;
    Long deletedAt;
    Long quotaLimit;
    Long quotaRemaining;
    Long quotaSyncedAt;
    long totalRequests;
    long successCount;
    long errorCount;
    long quotaExhaustedCount;

    public static KeyView of(ApiKeyEntity key) {
        return KeyView.builder()
                .id(key.getKeyId())
                .status(key.getStatus().wireName())
                .statusChangedAt(key.getStatusChangedAt())
                .lastUsedAt(key.getLastUsedAt())
                .deletedAt(key.getDeletedAt())
                .quotaLimit(key.getQuotaLimit())
                .quotaRemaining(key.getQuotaRemaining())
                .quotaSyncedAt(key.getQuotaSyncedAt())
                .totalRequests(nz(key.getTotalRequests()))
                .successCount(nz(key.getSuccessCount()))
                .errorCount(nz(key.getErrorCount()))
                .quotaExhaustedCount(nz(key.getQuotaExhaustedCount()))
                .build();
    }

    private static long nz(Long value) {
        return value == null ? 0L : value;
    }
}
