package com.searchgate.data.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 令牌配额占用记录：每次计入配额的调用一行，滚动窗口据此计数。
 */
@Table("t_token_quota_hit")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenQuotaHitEntity {

    @Id
    private Long id;

    private String tokenId;

    private Long createdAt;
}
