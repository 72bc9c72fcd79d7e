package com.searchgate.dispatcher.metrics;

import lombok.Builder;
import lombok.Value;

/**
 * 令牌持有者可见的日志，不含请求体、响应体，敏感值已脱敏。
 */
@Value
@Builder
public class PublicLogView {

    long id;
    String method;
    String path;
    String query;
    Integer httpStatus;
    Integer upstreamStatus;
    String resultStatus;
    String errorMessage;
    long createdAt;
}
