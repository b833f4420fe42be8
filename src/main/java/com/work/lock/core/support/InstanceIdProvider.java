package com.work.lock.core.support;

/**
 * 提供进程级稳定标识，用作锁记录的 owner 与日志标记。
 */
public interface InstanceIdProvider {
    String getInstanceId();
}
