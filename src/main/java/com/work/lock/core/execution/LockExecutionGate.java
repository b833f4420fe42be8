package com.work.lock.core.execution;

import com.work.lock.core.config.LockOptions;
import com.work.lock.core.exception.GuardedOperationException;
import com.work.lock.core.exception.LockException;
import com.work.lock.core.lock.LockCoordinator;
import com.work.lock.core.metrics.LockMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

import java.util.concurrent.ScheduledFuture;

import static com.work.lock.core.support.ValidationUtils.requireNonEmpty;
import static com.work.lock.core.support.ValidationUtils.requireNonNull;

/**
 * 执行闸门：每次触发先加锁，拿到锁才执行，执行结束（无论成败）立即释放。
 * <p>
 * 拿不到锁时直接跳过本次执行，不排队、不补偿，只留下日志。
 * 工作本身的异常在锁释放之后原样抛给触发方。
 */
public class LockExecutionGate {

    private static final Logger log = LoggerFactory.getLogger(LockExecutionGate.class);

    private final LockCoordinator coordinator;
    private final GuardedTaskRegistry registry;
    private final TaskScheduler taskScheduler;
    private final LockMetrics metrics;

    public LockExecutionGate(LockCoordinator coordinator,
                             GuardedTaskRegistry registry,
                             TaskScheduler taskScheduler,
                             LockMetrics metrics) {
        this.coordinator = requireNonNull(coordinator, "coordinator");
        this.registry = requireNonNull(registry, "registry");
        this.taskScheduler = requireNonNull(taskScheduler, "taskScheduler");
        this.metrics = requireNonNull(metrics, "metrics");
    }

    /**
     * @return true 表示拿到锁并执行了工作；false 表示锁被占用、本次跳过
     * @throws GuardedOperationException 工作抛出受检异常时（运行时异常原样抛出）
     */
    public boolean execute(LockOptions options, GuardedTask task) {
        requireNonNull(options, "options");
        requireNonNull(task, "task");

        String key = options.getKey();
        if (!coordinator.acquire(options)) {
            metrics.guardedRun(key, "skipped");
            log.debug("[lock] skipping execution, lock held by another instance: {}", key);
            return false;
        }

        try {
            task.run();
            metrics.guardedRun(key, "completed");
            return true;
        } catch (RuntimeException e) {
            metrics.guardedRun(key, "failed");
            throw e;
        } catch (Exception e) {
            metrics.guardedRun(key, "failed");
            throw new GuardedOperationException(key, e);
        } finally {
            releaseQuietly(key);
        }
    }

    /**
     * 把锁配置、工作与触发源绑定到调度器上，每次触发都经过 {@link #execute}。
     */
    public ScheduledFuture<?> guard(LockOptions options, GuardedTask task, Trigger trigger) {
        requireNonNull(options, "options");
        requireNonNull(task, "task");
        requireNonNull(trigger, "trigger");

        ScheduledFuture<?> future = taskScheduler.schedule(() -> execute(options, task), trigger);
        if (future == null) {
            throw new LockException("trigger produced no execution time for " + options.getKey());
        }
        log.info("[lock] guarded task scheduled, key={}, ttl={}s", options.getKey(), options.getTtlSeconds());
        return future;
    }

    /**
     * 调度注册表中的一个任务。
     */
    public ScheduledFuture<?> guard(GuardedTaskDefinition definition) {
        requireNonNull(definition, "definition");
        return guard(definition.getOptions(), definition.getTask(), definition.getTrigger());
    }

    /**
     * 手动触发一个已注册任务，同样受锁保护。
     *
     * @throws IllegalArgumentException 任务未注册
     */
    public boolean trigger(String name) {
        requireNonEmpty(name, "name");
        GuardedTaskDefinition definition = registry.find(name)
                .orElseThrow(() -> new IllegalArgumentException("unknown guarded task: " + name));
        log.info("[lock] manual trigger of task {}", name);
        return execute(definition.getOptions(), definition.getTask());
    }

    /**
     * release 自身不应掩盖工作抛出的异常。
     */
    private void releaseQuietly(String key) {
        try {
            coordinator.release(key);
        } catch (RuntimeException e) {
            log.warn("[lock] release failed for key={}, lock will expire by ttl", key, e);
        }
    }
}
