package com.searchgate.upstream.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 待转发到上游的请求（头部已按白名单过滤）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForwardRequest {

    private String method;

    /** 入站路径，如 /mcp */
    private String path;

    /** 原始查询串，不含 ? */
    private String query;

    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();

    private byte[] body;
}
