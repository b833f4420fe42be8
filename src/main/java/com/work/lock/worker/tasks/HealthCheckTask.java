package com.work.lock.worker.tasks;

import com.work.lock.core.lock.LockCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 每个实例各自运行的健康检查，不加锁。
 */
@Component
public class HealthCheckTask {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckTask.class);
    private static final long HEAP_WARN_MB = 500;

    private final LockCoordinator lockCoordinator;

    public HealthCheckTask(LockCoordinator lockCoordinator) {
        this.lockCoordinator = lockCoordinator;
    }

    @Scheduled(fixedDelayString = "${worker.tasks.health-check-interval-ms:30000}")
    public void checkHealth() {
        Runtime runtime = Runtime.getRuntime();
        long usedMb = (runtime.totalMemory() - runtime.freeMemory()) / (1024 * 1024);
        if (usedMb > HEAP_WARN_MB) {
            log.warn("high heap usage: {}MB", usedMb);
        }
        if (lockCoordinator.isDegraded()) {
            log.warn("[lock] running in degraded mode, guarded tasks are only exclusive within this instance");
        }
    }
}
