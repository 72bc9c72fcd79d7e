package com.searchgate.web.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Web 层配置项。
 */
@Data
@ConfigurationProperties(prefix = "searchgate.web")
public class WebProperties {

    /** 携带管理员口令的请求头 */
    private String adminHeader = "X-Admin-Token";

    /** 管理员口令，为空时管理接口全部拒绝（除非开启 devOpenAdmin） */
    private String adminToken = "";

    /** 本地开发时放开管理接口 */
    private boolean devOpenAdmin = false;

    /** 代理请求体上限（字节） */
    private long maxBodyBytes = 16L * 1024 * 1024;

    /** SSE 连接超时（毫秒），到期后客户端自动重连 */
    private long sseTimeoutMs = 30L * 60 * 1000;
}
