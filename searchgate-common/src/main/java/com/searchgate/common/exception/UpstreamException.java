package com.searchgate.common.exception;

/**
 * 上游搜索服务调用异常（网络错误、5xx 等）。
 * <p>
 * 临时性故障不会改变 Key 的健康状态。
 */
public class UpstreamException extends SearchGateException {

    /** 上游 HTTP 状态码，网络层失败时为 null */
    private final Integer httpStatus;

    public UpstreamException(String message) {
        this(message, null, null);
    }

    public UpstreamException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public UpstreamException(String message, Integer httpStatus, Throwable cause) {
        super("UPSTREAM_ERROR", message, cause);
        this.httpStatus = httpStatus;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }
}
