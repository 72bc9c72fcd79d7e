package com.searchgate.data.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 令牌按小时聚合的用量统计，由 usage_rollup 任务维护。
 */
@Table("t_token_usage_stat")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenUsageStatEntity {

    @Id
    private Long id;

    private String tokenId;

    private Long bucketStart;

    @Builder.Default
    private Long successCount = 0L;

    @Builder.Default
    private Long systemFailureCount = 0L;

    @Builder.Default
    private Long externalFailureCount = 0L;
}
