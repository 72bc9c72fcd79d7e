package com.searchgate.common.exception;

/**
 * 目标资源不存在（Key、令牌、任务等）。
 */
public class NotFoundException extends SearchGateException {

    public NotFoundException(String message) {
        super("NOT_FOUND", message);
    }
}
