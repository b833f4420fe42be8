package com.work.lock.core.store.impl;

import com.work.lock.core.exception.StoreUnavailableException;
import com.work.lock.core.store.LockStore;
import com.work.lock.core.support.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.Collections;
import java.util.Optional;

import static com.work.lock.core.support.ValidationUtils.requireNonEmpty;
import static com.work.lock.core.support.ValidationUtils.requirePositive;

/**
 * 基于 Redis 的共享锁存储
 *
 * 特性：
 * 1. 加锁使用 SET key value NX PX，一条命令完成条件写
 * 2. 依赖 Redis 原生 TTL，持有者宕机后锁自动失效
 * 3. 释放锁使用 Lua 脚本比对 owner 后删除
 * 4. 任何 Redis 访问异常（含命令超时）统一转换为 {@link StoreUnavailableException}
 */
public class RedisLockStore implements LockStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(RedisLockStore.class);

    // 只有锁的 owner 匹配时才删除
    private static final String UNLOCK_SCRIPT =
            "if redis.call('get', KEYS[1]) == ARGV[1] then " +
            "    return redis.call('del', KEYS[1]) " +
            "else " +
            "    return 0 " +
            "end";

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;
    private final DefaultRedisScript<Long> unlockScript;

    public RedisLockStore(StringRedisTemplate redisTemplate, String keyPrefix) {
        this.redisTemplate = ValidationUtils.requireNonNull(redisTemplate, "redisTemplate");
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
        this.unlockScript = new DefaultRedisScript<>();
        this.unlockScript.setScriptText(UNLOCK_SCRIPT);
        this.unlockScript.setResultType(Long.class);
    }

    @Override
    public boolean tryCreate(String key, String owner, Duration ttl) {
        requireNonEmpty(key, "key");
        requireNonEmpty(owner, "owner");
        requirePositive(ttl, "ttl");

        String redisKey = keyPrefix + key;
        try {
            Boolean result = redisTemplate.opsForValue().setIfAbsent(redisKey, owner, ttl);
            return Boolean.TRUE.equals(result);
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("Redis 加锁异常: " + redisKey, e);
        }
    }

    @Override
    public Optional<String> readOwner(String key) {
        requireNonEmpty(key, "key");

        String redisKey = keyPrefix + key;
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(redisKey));
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("Redis 读取锁异常: " + redisKey, e);
        }
    }

    @Override
    public boolean deleteIfOwner(String key, String owner) {
        requireNonEmpty(key, "key");
        requireNonEmpty(owner, "owner");

        String redisKey = keyPrefix + key;
        Long result;
        try {
            result = redisTemplate.execute(unlockScript, Collections.singletonList(redisKey), owner);
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("Redis 释放锁异常: " + redisKey, e);
        }
        // 0 表示锁不存在或 owner 不匹配（已过期或已被其他实例重新获取）
        if (result == null || result == 0) {
            LOGGER.debug("[lock] redis unlock noop, key={}, owner={}", redisKey, owner);
            return false;
        }
        return true;
    }

    @Override
    public String name() {
        return "redis";
    }
}
