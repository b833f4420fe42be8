package com.work.lock.worker.service;

import com.work.lock.core.support.InMemoryLockStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 周期清理兜底存储里的过期锁记录。
 * 访问时的惰性清理只覆盖被再次触碰的 key，这里兜住不再被访问的 key。
 */
@Component
public class FallbackLockSweeper {

    private static final Logger log = LoggerFactory.getLogger(FallbackLockSweeper.class);

    private final InMemoryLockStore fallbackLockStore;

    public FallbackLockSweeper(InMemoryLockStore fallbackLockStore) {
        this.fallbackLockStore = fallbackLockStore;
    }

    @Scheduled(fixedDelayString = "${lock.sweep-interval-ms:60000}")
    public void sweep() {
        int purged = fallbackLockStore.purgeExpired();
        if (purged > 0) {
            log.debug("[lock] purged {} expired local lock record(s)", purged);
        }
    }
}
