package com.work.lock.worker.service;

import com.work.lock.core.execution.GuardedTaskDefinition;
import com.work.lock.core.execution.GuardedTaskRegistry;
import com.work.lock.core.execution.LockExecutionGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * 启动时把注册表里所有带触发源的任务挂到调度器上，关闭时取消后续触发。
 * 已经在执行的任务不会被打断。
 */
@Component
public class GuardedTaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(GuardedTaskScheduler.class);

    private final GuardedTaskRegistry registry;
    private final LockExecutionGate gate;
    private final List<ScheduledFuture<?>> scheduled = new ArrayList<>();

    public GuardedTaskScheduler(GuardedTaskRegistry registry, LockExecutionGate gate) {
        this.registry = registry;
        this.gate = gate;
    }

    @PostConstruct
    public synchronized void start() {
        for (GuardedTaskDefinition definition : registry.definitions()) {
            if (!definition.isScheduled()) {
                continue;
            }
            scheduled.add(gate.guard(definition));
        }
        log.info("[lock] {} guarded task(s) scheduled", scheduled.size());
    }

    @PreDestroy
    public synchronized void stop() {
        for (ScheduledFuture<?> future : scheduled) {
            future.cancel(false);
        }
        scheduled.clear();
    }

    public synchronized int scheduledCount() {
        return scheduled.size();
    }
}
