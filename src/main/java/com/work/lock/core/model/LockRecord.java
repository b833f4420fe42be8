package com.work.lock.core.model;

import java.time.Instant;

/**
 * 一条锁记录。只由成功的 acquire 创建，之后不做原地修改，
 * 由持有者释放或在 expiresAt 之后被惰性清理。
 */
public final class LockRecord {

    private final String key;
    private final String ownerId;
    private final Instant expiresAt;

    public LockRecord(String key, String ownerId, Instant expiresAt) {
        this.key = key;
        this.ownerId = ownerId;
        this.expiresAt = expiresAt;
    }

    public String getKey() {
        return key;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    /**
     * 到达 expiresAt 即视为过期。
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isOwnedBy(String owner) {
        return ownerId.equals(owner);
    }

    @Override
    public String toString() {
        return "LockRecord{key='" + key + "', ownerId='" + ownerId + "', expiresAt=" + expiresAt + '}';
    }
}
