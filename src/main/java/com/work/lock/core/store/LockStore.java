package com.work.lock.core.store;

import java.time.Duration;
import java.util.Optional;

/**
 * 锁记录的存储端口。共享存储（Redis）与进程内兜底存储实现同一组能力。
 * <p>
 * 所有实现都必须满足：同一 key 在同一 store 内任意时刻至多存在一条未过期记录。
 * 远程实现在不可达时抛出 {@link com.work.lock.core.exception.StoreUnavailableException}。
 */
public interface LockStore {

    /**
     * 原子地“不存在则创建”。必须是一次条件写，不能拆成先读后写。
     *
     * @param key   锁 key
     * @param owner 持有者标识
     * @param ttl   记录存活时间
     * @return true 表示记录由本次调用创建；false 表示已存在未过期记录
     */
    boolean tryCreate(String key, String owner, Duration ttl);

    /**
     * 读取当前未过期记录的持有者。
     */
    Optional<String> readOwner(String key);

    /**
     * 仅当持有者匹配时删除记录。
     *
     * @return true 表示确实删除了一条记录
     */
    boolean deleteIfOwner(String key, String owner);

    /**
     * 是否具备原子条件写原语。不具备的 store 会在装配期被协调器拒绝。
     */
    default boolean supportsAtomicCreate() {
        return true;
    }

    /**
     * 用于日志与指标的简短名称。
     */
    String name();
}
