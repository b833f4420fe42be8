package com.work.lock.core.config;

/**
 * 纯组件侧的配置定义，不依赖任意框架。宿主应用（如 Spring Boot）只需在装配时
 * 将自身读取到的配置参数注入即可，确保 core 包保持与业务、框架解耦。
 */
public class LockCoordinatorConfig {

    private final boolean remoteEnabled;
    private final String keyPrefix;

    public LockCoordinatorConfig(boolean remoteEnabled, String keyPrefix) {
        this.remoteEnabled = remoteEnabled;
        this.keyPrefix = keyPrefix;
    }

    public boolean isRemoteEnabled() {
        return remoteEnabled;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }
}
