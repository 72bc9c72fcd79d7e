package com.searchgate.data.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 上游 Key：每个真实密钥只有一行，删除为软删除。
 * 时间字段均为 epoch 秒。
 */
@Table("t_api_key")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiKeyEntity {

    @Id
    private Long id;

    /** 对外短标识，稳定且不复用 */
    private String keyId;

    /** 真实密钥，仅管理员可见 */
    private String secret;

    @Builder.Default
    private KeyStatus status = KeyStatus.ACTIVE;

    private Long statusChangedAt;

    @Builder.Default
    private Long lastUsedAt = 0L;

    private Long deletedAt;

    /** 软删除前的健康状态，恢复时原样还原 */
    private KeyStatus statusBeforeDelete;

    private Long quotaLimit;
    private Long quotaRemaining;
    private Long quotaSyncedAt;

    @Builder.Default
    private Long totalRequests = 0L;

    @Builder.Default
    private Long successCount = 0L;

    @Builder.Default
    private Long errorCount = 0L;

    @Builder.Default
    private Long quotaExhaustedCount = 0L;

    private Long createdAt;
}
