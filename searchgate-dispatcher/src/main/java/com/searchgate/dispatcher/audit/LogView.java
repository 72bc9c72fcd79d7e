package com.searchgate.dispatcher.audit;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 审计日志对外视图。
 */
@Value
@Builder
public class LogView {

    long id;
    String keyId;
    String authTokenId;
    String method;
    String path;
    String query;
    Integer httpStatus;
    Integer upstreamStatus;
    String resultStatus;
    String errorMessage;
    String requestBody;
    String responseBody;
    List<String> forwardedHeaders;
    List<String> droppedHeaders;
    long createdAt;
}
