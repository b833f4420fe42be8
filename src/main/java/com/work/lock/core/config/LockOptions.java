package com.work.lock.core.config;

import java.time.Duration;
import java.util.Objects;

import static com.work.lock.core.support.ValidationUtils.requireAtMost;
import static com.work.lock.core.support.ValidationUtils.requireNonNegative;
import static com.work.lock.core.support.ValidationUtils.requirePositive;
import static com.work.lock.core.support.ValidationUtils.requireValidLockKey;

/**
 * 单个受保护操作的静态加锁配置：锁 key、TTL 与重试策略。不可变。
 */
public final class LockOptions {

    public static final long DEFAULT_TTL_SECONDS = 60L;
    public static final int DEFAULT_MAX_RETRIES = 0;
    public static final long DEFAULT_RETRY_DELAY_MS = 100L;
    /**
     * TTL 上限 30 天。锁只是崩溃后的兜底，更长的 TTL 没有意义，且会让到期时间计算溢出。
     */
    public static final long MAX_TTL_SECONDS = 30L * 24 * 3600;

    private final String key;
    private final long ttlSeconds;
    private final int maxRetries;
    private final long retryDelayMs;

    public LockOptions(String key, long ttlSeconds, int maxRetries, long retryDelayMs) {
        this.key = requireValidLockKey(key);
        this.ttlSeconds = requireAtMost(requirePositive(ttlSeconds, "ttlSeconds"), MAX_TTL_SECONDS, "ttlSeconds");
        this.maxRetries = (int) requireNonNegative(maxRetries, "maxRetries");
        this.retryDelayMs = requireNonNegative(retryDelayMs, "retryDelayMs");
    }

    /**
     * 全部使用默认值：TTL 60 秒，不重试。
     */
    public static LockOptions of(String key) {
        return new LockOptions(key, DEFAULT_TTL_SECONDS, DEFAULT_MAX_RETRIES, DEFAULT_RETRY_DELAY_MS);
    }

    public static LockOptions of(String key, long ttlSeconds) {
        return new LockOptions(key, ttlSeconds, DEFAULT_MAX_RETRIES, DEFAULT_RETRY_DELAY_MS);
    }

    public LockOptions withRetries(int maxRetries, long retryDelayMs) {
        return new LockOptions(key, ttlSeconds, maxRetries, retryDelayMs);
    }

    public String getKey() {
        return key;
    }

    public long getTtlSeconds() {
        return ttlSeconds;
    }

    public Duration getTtl() {
        return Duration.ofSeconds(ttlSeconds);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public long getRetryDelayMs() {
        return retryDelayMs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LockOptions)) return false;
        LockOptions that = (LockOptions) o;
        return ttlSeconds == that.ttlSeconds
                && maxRetries == that.maxRetries
                && retryDelayMs == that.retryDelayMs
                && key.equals(that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, ttlSeconds, maxRetries, retryDelayMs);
    }

    @Override
    public String toString() {
        return "LockOptions{key='" + key + "', ttlSeconds=" + ttlSeconds
                + ", maxRetries=" + maxRetries + ", retryDelayMs=" + retryDelayMs + '}';
    }
}
