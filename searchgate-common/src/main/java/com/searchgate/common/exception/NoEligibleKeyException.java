package com.searchgate.common.exception;

/**
 * Key 池耗尽异常，所有 Key 均已耗尽、禁用或删除时抛出。
 */
public class NoEligibleKeyException extends SearchGateException {

    public NoEligibleKeyException(String message) {
        super("KEY_EXHAUSTED", message);
    }
}
