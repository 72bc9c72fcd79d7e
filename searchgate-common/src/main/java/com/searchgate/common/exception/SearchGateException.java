package com.searchgate.common.exception;

/**
 * 系统基础异常，所有业务异常的父类。
 */
public class SearchGateException extends RuntimeException {

    private final String errorCode;

    public SearchGateException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public SearchGateException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
