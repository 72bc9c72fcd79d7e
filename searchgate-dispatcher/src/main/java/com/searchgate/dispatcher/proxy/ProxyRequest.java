package com.searchgate.dispatcher.proxy;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 入站代理请求，headers 为原始请求头（尚未过滤，值已合并）。
 */
@Value
@Builder
public class ProxyRequest {

    String method;
    String path;
    String query;
    Map<String, String> headers;
    byte[] body;

    /** Authorization 中 Bearer 之后的令牌串 */
    String bearerToken;
}
