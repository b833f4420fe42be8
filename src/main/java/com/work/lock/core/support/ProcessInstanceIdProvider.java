package com.work.lock.core.support;

import java.net.InetAddress;
import java.time.Instant;
import java.util.UUID;

/**
 * 默认实例标识：hostname + pid + 进程启动时间 + 随机后缀。
 * <p>
 * 构造时生成一次，进程生命周期内不变。随机部分保证同一主机上 pid 复用时仍不冲突。
 */
public class ProcessInstanceIdProvider implements InstanceIdProvider {

    private final String instanceId;

    public ProcessInstanceIdProvider() {
        this.instanceId = buildInstanceId();
    }

    @Override
    public String getInstanceId() {
        return instanceId;
    }

    private String buildInstanceId() {
        ProcessHandle self = ProcessHandle.current();
        long startedAt = self.info().startInstant().orElse(Instant.now()).toEpochMilli();
        String random = UUID.randomUUID().toString().substring(0, 8);
        return hostname() + "-" + self.pid() + "-" + startedAt + "-" + random;
    }

    private String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (Exception e) {
            return "unknown";
        }
    }
}
