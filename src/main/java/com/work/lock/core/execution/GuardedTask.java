package com.work.lock.core.execution;

/**
 * 受锁保护的一段工作。
 */
@FunctionalInterface
public interface GuardedTask {

    void run() throws Exception;
}
