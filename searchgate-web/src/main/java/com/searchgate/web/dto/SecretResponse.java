package com.searchgate.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 明文密钥（Key 或完整令牌），仅管理员可见。
 */
@Data
@AllArgsConstructor
public class SecretResponse {

    private String id;
    private String secret;
}
