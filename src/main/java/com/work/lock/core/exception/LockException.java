package com.work.lock.core.exception;

/**
 * 组件内部的统一异常类型，便于宿主应用统一捕获或转换为错误码。
 */
public class LockException extends RuntimeException {

    public LockException(String message) {
        super(message);
    }

    public LockException(String message, Throwable cause) {
        super(message, cause);
    }
}
