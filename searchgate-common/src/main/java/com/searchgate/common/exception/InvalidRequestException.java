package com.searchgate.common.exception;

/**
 * 请求参数不合法。
 */
public class InvalidRequestException extends SearchGateException {

    public InvalidRequestException(String message) {
        super("INVALID_REQUEST", message);
    }
}
