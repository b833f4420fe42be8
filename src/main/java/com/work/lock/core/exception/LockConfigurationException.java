package com.work.lock.core.exception;

/**
 * 装配期的配置错误，例如 store 不具备原子条件写能力、注册表中出现重复的任务或锁 key。
 */
public class LockConfigurationException extends LockException {

    public LockConfigurationException(String message) {
        super(message);
    }
}
