package com.searchgate.common.exception;

/**
 * 访问令牌缺失、格式错误、已禁用或密钥不匹配。
 */
public class UnauthorizedException extends SearchGateException {

    public UnauthorizedException(String message) {
        super("UNAUTHORIZED", message);
    }
}
