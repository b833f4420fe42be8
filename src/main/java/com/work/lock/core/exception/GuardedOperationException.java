package com.work.lock.core.exception;

/**
 * 受保护任务自身抛出的受检异常的包装。锁在抛出之前已经释放。
 */
public class GuardedOperationException extends LockException {

    private final String lockKey;

    public GuardedOperationException(String lockKey, Throwable cause) {
        super("guarded operation failed: " + lockKey, cause);
        this.lockKey = lockKey;
    }

    public String getLockKey() {
        return lockKey;
    }
}
