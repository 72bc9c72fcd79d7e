package com.searchgate.web.dto;

import lombok.Data;

/**
 * Key 状态（active / disabled）或令牌启停。
 */
@Data
public class StatusRequest {

    private String status;

    private Boolean enabled;
}
