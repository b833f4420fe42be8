package com.work.lock.worker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;

/**
 * 仅存在于 worker/宿主包，用于从 application.yml 读取配置。
 * 再由配置类转换为 core 包所需的 {@link com.work.lock.core.config.LockCoordinatorConfig}。
 */
@Validated
@ConfigurationProperties(prefix = "lock")
public class LockProperties {

    /**
     * 关闭后不创建 Redis store，所有锁只在进程内协调。
     */
    private boolean redisEnabled = true;

    @NotNull
    private String keyPrefix = "lock:";

    /**
     * 调度线程数。不同 key 的任务并行执行，某个任务卡在存储访问上不会阻塞其他任务。
     */
    @Min(1)
    private int schedulerPoolSize = 4;

    /**
     * 启动时是否探测 Redis 可用性（只打日志，不影响启动）。
     */
    private boolean probeOnStartup = true;

    public boolean isRedisEnabled() {
        return redisEnabled;
    }

    public void setRedisEnabled(boolean redisEnabled) {
        this.redisEnabled = redisEnabled;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public int getSchedulerPoolSize() {
        return schedulerPoolSize;
    }

    public void setSchedulerPoolSize(int schedulerPoolSize) {
        this.schedulerPoolSize = schedulerPoolSize;
    }

    public boolean isProbeOnStartup() {
        return probeOnStartup;
    }

    public void setProbeOnStartup(boolean probeOnStartup) {
        this.probeOnStartup = probeOnStartup;
    }
}
