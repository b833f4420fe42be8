package com.work.lock.core.lock;

import com.work.lock.core.config.LockOptions;
import com.work.lock.core.exception.LockConfigurationException;
import com.work.lock.core.exception.StoreUnavailableException;
import com.work.lock.core.metrics.LockMetrics;
import com.work.lock.core.store.LockStore;
import com.work.lock.core.support.InstanceIdProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.work.lock.core.support.ValidationUtils.requireNonNull;
import static com.work.lock.core.support.ValidationUtils.requireValidLockKey;

/**
 * 锁 key 维度的互斥协调器，集中管理加锁/释放、重试以及远程/兜底存储的选择。
 * <p>
 * 每次访问优先走远程共享存储；远程不可达时本次调用透明地退回进程内兜底存储，
 * 此时只能保证当前进程内不重复执行。
 * <p>
 * 线程安全：多个 key 的并发加锁/释放只触碰 {@link ConcurrentHashMap} 与各 store 自身的原子操作。
 */
public class LockCoordinator {

    private static final Logger log = LoggerFactory.getLogger(LockCoordinator.class);

    private final LockStore remote;
    private final LockStore fallback;
    private final String instanceId;
    private final LockMetrics metrics;

    private final Clock clock;

    /**
     * 本实例当前持有（或正在争抢）的锁。先占位再访问 store，同一进程内同一 key 至多一个持有者，
     * 与 store 的健康状态如何切换无关；释放时按记录的 store 路由。
     */
    private final Map<String, Holding> heldLocks = new ConcurrentHashMap<>();
    private final AtomicBoolean degraded = new AtomicBoolean(false);

    /**
     * @param remote   共享存储，为 null 表示未启用，所有操作直接走兜底存储
     * @param fallback 进程内兜底存储
     */
    public LockCoordinator(LockStore remote,
                           LockStore fallback,
                           InstanceIdProvider instanceIdProvider,
                           LockMetrics metrics) {
        this(remote, fallback, instanceIdProvider, metrics, Clock.systemUTC());
    }

    public LockCoordinator(LockStore remote,
                           LockStore fallback,
                           InstanceIdProvider instanceIdProvider,
                           LockMetrics metrics,
                           Clock clock) {
        this.clock = requireNonNull(clock, "clock");
        this.fallback = requireAtomic(requireNonNull(fallback, "fallback"));
        this.remote = remote == null ? null : requireAtomic(remote);
        this.instanceId = requireNonNull(instanceIdProvider, "instanceIdProvider").getInstanceId();
        this.metrics = requireNonNull(metrics, "metrics");
        if (this.remote == null) {
            log.info("[lock] remote store disabled, coordinating with local store only, instance={}", instanceId);
        } else {
            log.info("[lock] coordinator ready, remote={}, fallback={}, instance={}",
                    remote.name(), fallback.name(), instanceId);
        }
    }

    /**
     * 尝试获取锁。
     * <p>
     * 每次尝试都是一次原子的“不存在则创建”；被拒绝且 maxRetries &gt; 0 时，
     * 间隔 retryDelayMs 重试，总尝试次数至多 maxRetries + 1。
     *
     * @return true 表示加锁成功；false 表示锁被占用（正常结果，不抛异常）
     */
    public boolean acquire(LockOptions options) {
        requireNonNull(options, "options");

        String key = options.getKey();
        int attempts = options.getMaxRetries() + 1;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            LockStore winner = reserveAndCreate(options);
            if (winner != null) {
                metrics.acquire(winner.name(), "acquired");
                log.debug("[lock] acquired key={} store={} attempt={}", key, winner.name(), attempt);
                return true;
            }
            if (attempt < attempts && !pause(options.getRetryDelayMs())) {
                log.debug("[lock] interrupted while waiting to retry key={}", key);
                return false;
            }
        }
        metrics.acquire(activeStoreName(), "refused");
        log.debug("[lock] refused key={} after {} attempt(s), held by another owner", key, attempts);
        return false;
    }

    /**
     * 释放锁：仅当记录的持有者是本实例时才删除，否则为 no-op。
     */
    public void release(String key) {
        requireValidLockKey(key);

        LockStore target = null;
        Holding holding = heldLocks.get(key);
        // 正在争抢中的占位不属于任何已完成的加锁，不能被释放掉
        if (holding != null && holding.store != null && heldLocks.remove(key, holding)) {
            target = holding.store;
        }
        if (target == null) {
            target = remote != null ? remote : fallback;
        }

        boolean deleted;
        if (target == fallback) {
            deleted = fallback.deleteIfOwner(key, instanceId);
        } else {
            try {
                deleted = remote.deleteIfOwner(key, instanceId);
                markRecovered();
            } catch (StoreUnavailableException e) {
                markDegraded("release", e);
                // 远程持有的锁只能等 TTL 到期；兜底存储里若有本实例的记录一并清掉
                deleted = fallback.deleteIfOwner(key, instanceId);
            }
        }

        if (deleted) {
            metrics.release(target.name(), "released");
            log.debug("[lock] released key={} store={}", key, target.name());
        } else {
            metrics.release(target.name(), "not_owner");
            log.debug("[lock] release noop, key={} expired or owned by another instance, owner={}", key, instanceId);
        }
    }

    /**
     * 是否存在该 key 的未过期记录（远程或本进程兜底存储）。
     */
    public boolean isLocked(String key) {
        requireValidLockKey(key);

        if (fallback.readOwner(key).isPresent()) {
            return true;
        }
        if (remote == null) {
            return false;
        }
        try {
            Optional<String> owner = remote.readOwner(key);
            markRecovered();
            return owner.isPresent();
        } catch (StoreUnavailableException e) {
            markDegraded("isLocked", e);
            return false;
        }
    }

    /**
     * 最近一次远程访问是否失败。
     */
    public boolean isDegraded() {
        return degraded.get();
    }

    public String getInstanceId() {
        return instanceId;
    }

    /**
     * 先在进程内占位，占位成功才去 store 创建记录；失败时撤销占位。
     * 本进程已持有该 key（不论记录落在哪个 store）时直接拒绝。
     */
    private LockStore reserveAndCreate(LockOptions options) {
        String key = options.getKey();
        Holding reservation = new Holding();
        Holding existing = heldLocks.putIfAbsent(key, reservation);
        if (existing != null) {
            if (!existing.isExpired(clock.millis())) {
                log.debug("[lock] key={} already held within this instance", key);
                return null;
            }
            // 持有方没有释放且 TTL 已过，记录早已失效
            if (!heldLocks.replace(key, existing, reservation)) {
                return null;
            }
        }

        LockStore winner;
        try {
            winner = tryCreateOnce(options);
        } catch (RuntimeException e) {
            heldLocks.remove(key, reservation);
            throw e;
        }
        if (winner == null) {
            heldLocks.remove(key, reservation);
            return null;
        }
        reservation.grant(winner, clock.millis() + options.getTtl().toMillis());
        return winner;
    }

    /**
     * 单次尝试：远程优先，远程不可达时退回兜底存储。
     *
     * @return 成功创建记录的 store；未成功返回 null
     */
    private LockStore tryCreateOnce(LockOptions options) {
        if (remote != null) {
            try {
                boolean created = remote.tryCreate(options.getKey(), instanceId, options.getTtl());
                markRecovered();
                return created ? remote : null;
            } catch (StoreUnavailableException e) {
                markDegraded("acquire", e);
            }
        }
        return fallback.tryCreate(options.getKey(), instanceId, options.getTtl()) ? fallback : null;
    }

    private void markDegraded(String op, StoreUnavailableException e) {
        metrics.storeUnavailable(op);
        if (degraded.compareAndSet(false, true)) {
            log.warn("[lock] remote store {} unreachable during {}, degraded to process-local locking: {}",
                    remote.name(), op, e.getMessage());
        } else {
            log.debug("[lock] remote store still unreachable during {}", op);
        }
    }

    private void markRecovered() {
        if (degraded.compareAndSet(true, false)) {
            log.info("[lock] remote store {} reachable again, leaving degraded mode", remote.name());
        }
    }

    private String activeStoreName() {
        return remote == null || degraded.get() ? fallback.name() : remote.name();
    }

    private boolean pause(long delayMs) {
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static LockStore requireAtomic(LockStore store) {
        if (!store.supportsAtomicCreate()) {
            throw new LockConfigurationException(
                    "store '" + store.name() + "' has no atomic conditional write, cannot guarantee mutual exclusion");
        }
        return store;
    }

    /**
     * store 为 null 表示占位中，尚未拿到锁。
     */
    private static final class Holding {
        private volatile LockStore store;
        private volatile long expiresAtMillis = Long.MAX_VALUE;

        void grant(LockStore grantedBy, long expiresAt) {
            this.expiresAtMillis = expiresAt;
            this.store = grantedBy;
        }

        boolean isExpired(long nowMillis) {
            return store != null && nowMillis >= expiresAtMillis;
        }
    }
}
