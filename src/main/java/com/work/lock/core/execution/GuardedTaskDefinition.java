package com.work.lock.core.execution;

import com.work.lock.core.config.LockOptions;
import org.springframework.scheduling.Trigger;

import static com.work.lock.core.support.ValidationUtils.requireNonEmpty;
import static com.work.lock.core.support.ValidationUtils.requireNonNull;

/**
 * 一个受保护任务的完整绑定：名称、锁配置、工作本身与触发源。
 * trigger 为 null 表示只允许手动触发。
 */
public final class GuardedTaskDefinition {

    private final String name;
    private final LockOptions options;
    private final GuardedTask task;
    private final Trigger trigger;

    public GuardedTaskDefinition(String name, LockOptions options, GuardedTask task, Trigger trigger) {
        this.name = requireNonEmpty(name, "name");
        this.options = requireNonNull(options, "options");
        this.task = requireNonNull(task, "task");
        this.trigger = trigger;
    }

    public String getName() {
        return name;
    }

    public LockOptions getOptions() {
        return options;
    }

    public GuardedTask getTask() {
        return task;
    }

    public Trigger getTrigger() {
        return trigger;
    }

    public boolean isScheduled() {
        return trigger != null;
    }
}
