package com.searchgate.data.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 下游访问令牌。标识与密钥解耦：轮换密钥保留 tokenId 和用量。
 * 三个窗口的限额为空时使用全局默认值。
 */
@Table("t_auth_token")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthTokenEntity {

    @Id
    private Long id;

    /** 4 位短标识 */
    private String tokenId;

    private String secret;

    @Builder.Default
    private TokenStatus status = TokenStatus.ENABLED;

    private String note;

    private String groupName;

    private Long hourlyLimit;
    private Long dailyLimit;
    private Long monthlyLimit;

    @Builder.Default
    private Long totalRequests = 0L;

    private Long createdAt;

    private Long lastUsedAt;

    private Long deletedAt;
}
