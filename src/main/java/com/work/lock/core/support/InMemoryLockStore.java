package com.work.lock.core.support;

import com.work.lock.core.model.LockRecord;
import com.work.lock.core.store.LockStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.work.lock.core.support.ValidationUtils.requireNonEmpty;
import static com.work.lock.core.support.ValidationUtils.requireNonNull;
import static com.work.lock.core.support.ValidationUtils.requirePositive;

/**
 * 使用 ConcurrentHashMap 实现的进程内兜底锁存储。
 * <p>
 * 所有写操作都在 {@link ConcurrentHashMap#compute} 内完成，同一 key 的判断与写入是原子的。
 * 记录仅对当前进程可见，只能防止本进程内的重复执行。
 */
public class InMemoryLockStore implements LockStore {

    private final Map<String, LockRecord> locks = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryLockStore() {
        this(Clock.systemUTC());
    }

    public InMemoryLockStore(Clock clock) {
        this.clock = requireNonNull(clock, "clock");
    }

    @Override
    public boolean tryCreate(String key, String owner, Duration ttl) {
        requireNonEmpty(key, "key");
        requireNonEmpty(owner, "owner");
        requirePositive(ttl, "ttl");

        AtomicBoolean created = new AtomicBoolean(false);
        locks.compute(key, (k, existing) -> {
            Instant now = clock.instant();
            if (existing == null || existing.isExpired(now)) {
                created.set(true);
                return new LockRecord(k, owner, now.plus(ttl));
            }
            return existing;
        });
        return created.get();
    }

    @Override
    public Optional<String> readOwner(String key) {
        requireNonEmpty(key, "key");
        // 过期记录在读取时顺带移除
        LockRecord current = locks.computeIfPresent(key,
                (k, existing) -> existing.isExpired(clock.instant()) ? null : existing);
        return current == null ? Optional.empty() : Optional.of(current.getOwnerId());
    }

    @Override
    public boolean deleteIfOwner(String key, String owner) {
        requireNonEmpty(key, "key");
        requireNonEmpty(owner, "owner");

        AtomicBoolean deleted = new AtomicBoolean(false);
        locks.computeIfPresent(key, (k, existing) -> {
            if (existing.isExpired(clock.instant())) {
                return null;
            }
            if (existing.isOwnedBy(owner)) {
                deleted.set(true);
                return null;
            }
            return existing;
        });
        return deleted.get();
    }

    /**
     * 清理所有已过期记录，返回清理条数。
     */
    public int purgeExpired() {
        int purged = 0;
        for (String key : locks.keySet()) {
            AtomicBoolean removed = new AtomicBoolean(false);
            locks.computeIfPresent(key, (k, existing) -> {
                if (existing.isExpired(clock.instant())) {
                    removed.set(true);
                    return null;
                }
                return existing;
            });
            if (removed.get()) {
                purged++;
            }
        }
        return purged;
    }

    /**
     * 当前记录数（含尚未被清理的过期记录）。
     */
    public int size() {
        return locks.size();
    }

    @Override
    public String name() {
        return "local";
    }
}
