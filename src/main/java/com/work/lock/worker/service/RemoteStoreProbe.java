package com.work.lock.worker.service;

import com.work.lock.core.exception.StoreUnavailableException;
import com.work.lock.core.store.impl.RedisLockStore;
import com.work.lock.core.support.InstanceIdProvider;
import com.work.lock.worker.config.LockProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import java.time.Duration;
import java.util.Optional;

/**
 * 启动时探测 Redis：写入、读回、删除一条探测锁记录，只打日志。
 * Redis 不可用是合法的运行状态，锁会自动退回进程内协调，因此探测失败不影响启动。
 */
@Component
@ConditionalOnProperty(prefix = "lock", name = "redis-enabled", havingValue = "true", matchIfMissing = true)
public class RemoteStoreProbe {

    private static final Logger log = LoggerFactory.getLogger(RemoteStoreProbe.class);
    private static final String PROBE_KEY = "probe:init";

    private final RedisLockStore redisLockStore;
    private final InstanceIdProvider instanceIdProvider;
    private final LockProperties properties;

    public RemoteStoreProbe(RedisLockStore redisLockStore,
                            InstanceIdProvider instanceIdProvider,
                            LockProperties properties) {
        this.redisLockStore = redisLockStore;
        this.instanceIdProvider = instanceIdProvider;
        this.properties = properties;
    }

    @PostConstruct
    public void probeOnStartup() {
        if (properties.isProbeOnStartup()) {
            probe();
        }
    }

    /**
     * @return true 表示 Redis 可正常完成一次加锁/读取/释放
     */
    public boolean probe() {
        String owner = instanceIdProvider.getInstanceId();
        String key = PROBE_KEY + ":" + owner.hashCode();
        try {
            boolean created = redisLockStore.tryCreate(key, owner, Duration.ofSeconds(5));
            Optional<String> readBack = redisLockStore.readOwner(key);
            redisLockStore.deleteIfOwner(key, owner);
            if (created && readBack.filter(owner::equals).isPresent()) {
                log.info("[lock] redis lock store reachable, prefix={}", properties.getKeyPrefix());
                return true;
            }
            log.warn("[lock] redis lock store probe inconsistent (created={}, owner={}), locks may fall back to local",
                    created, readBack.orElse(null));
            return false;
        } catch (StoreUnavailableException e) {
            log.warn("[lock] redis lock store unreachable at startup, locks will fall back to local: {}", e.getMessage());
            return false;
        }
    }
}
