package com.searchgate.common.exception;

/**
 * 上游用量同步失败：用量接口返回错误，或响应中缺少配额数据。
 */
public class UsageSyncException extends SearchGateException {

    public enum Reason {
        /** 用量接口返回非 2xx */
        USAGE_HTTP,
        /** 响应中找不到 limit / usage 字段 */
        QUOTA_DATA_MISSING
    }

    private final Reason reason;
    private final Integer httpStatus;

    public UsageSyncException(Reason reason, Integer httpStatus, String message) {
        super("USAGE_SYNC", message);
        this.reason = reason;
        this.httpStatus = httpStatus;
    }

    public UsageSyncException(String message, Throwable cause) {
        super("USAGE_SYNC", message, cause);
        this.reason = Reason.USAGE_HTTP;
        this.httpStatus = null;
    }

    public Reason getReason() {
        return reason;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }
}
