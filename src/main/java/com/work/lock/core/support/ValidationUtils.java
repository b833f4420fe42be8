package com.work.lock.core.support;

import java.time.Duration;
import java.util.regex.Pattern;

/**
 * 锁组件的入参校验，失败统一抛 {@link IllegalArgumentException}。
 */
public final class ValidationUtils {

    // 锁 key 同时用作 Redis key 后缀与日志字段，限制为可打印的短标识
    private static final Pattern LOCK_KEY_PATTERN = Pattern.compile("^[a-zA-Z0-9:._-]{1,128}$");

    private ValidationUtils() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static String requireNonEmpty(String value, String paramName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(paramName + " 不能为空");
        }
        return value;
    }

    public static <T> T requireNonNull(T value, String paramName) {
        if (value == null) {
            throw new IllegalArgumentException(paramName + " 不能为null");
        }
        return value;
    }

    /**
     * TTL 之类的时长必须严格为正。
     */
    public static Duration requirePositive(Duration duration, String paramName) {
        requireNonNull(duration, paramName);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(paramName + " 必须大于0");
        }
        return duration;
    }

    public static long requirePositive(long value, String paramName) {
        if (value <= 0) {
            throw new IllegalArgumentException(paramName + " 必须大于0");
        }
        return value;
    }

    public static long requireNonNegative(long value, String paramName) {
        if (value < 0) {
            throw new IllegalArgumentException(paramName + " 不能为负数");
        }
        return value;
    }

    public static long requireAtMost(long value, long max, String paramName) {
        if (value > max) {
            throw new IllegalArgumentException(paramName + " 不能超过 " + max);
        }
        return value;
    }

    /**
     * 锁 key：1~128 位，仅允许 [a-zA-Z0-9:._-]。
     */
    public static String requireValidLockKey(String key) {
        requireNonEmpty(key, "key");
        if (!LOCK_KEY_PATTERN.matcher(key).matches()) {
            throw new IllegalArgumentException("key 非法，只允许 1~128 位的字母、数字、':'、'.'、'_'、'-'");
        }
        return key;
    }
}
