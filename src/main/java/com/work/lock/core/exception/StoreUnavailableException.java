package com.work.lock.core.exception;

/**
 * 共享存储不可达（连接失败 / 超时）。
 * <p>
 * 仅在 store 适配层与协调器之间流转：协调器捕获后切换到本地兜底存储，不会抛给 acquire 的调用方。
 */
public class StoreUnavailableException extends LockException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
