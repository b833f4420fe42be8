package com.work.lock.core.execution;

import com.work.lock.core.config.LockOptions;
import com.work.lock.core.exception.LockConfigurationException;
import org.springframework.scheduling.Trigger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 装配期显式构建的任务注册表：任务名 → 锁配置 + 工作 + 触发源。
 * <p>
 * 任务名与锁 key 都必须唯一，重复注册在装配期直接失败。
 * 注册在启动阶段单线程完成，之后只读。
 */
public class GuardedTaskRegistry {

    private final Map<String, GuardedTaskDefinition> byName = new LinkedHashMap<>();
    private final Map<String, String> nameByKey = new LinkedHashMap<>();

    public GuardedTaskRegistry register(String name, LockOptions options, GuardedTask task, Trigger trigger) {
        return register(new GuardedTaskDefinition(name, options, task, trigger));
    }

    public synchronized GuardedTaskRegistry register(GuardedTaskDefinition definition) {
        String name = definition.getName();
        String key = definition.getOptions().getKey();
        if (byName.containsKey(name)) {
            throw new LockConfigurationException("duplicate guarded task: " + name);
        }
        String boundTo = nameByKey.get(key);
        if (boundTo != null) {
            throw new LockConfigurationException("lock key '" + key + "' already bound to task " + boundTo);
        }
        byName.put(name, definition);
        nameByKey.put(key, name);
        return this;
    }

    public synchronized Optional<GuardedTaskDefinition> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public Optional<LockOptions> optionsFor(String name) {
        return find(name).map(GuardedTaskDefinition::getOptions);
    }

    public synchronized List<GuardedTaskDefinition> definitions() {
        return Collections.unmodifiableList(new ArrayList<>(byName.values()));
    }
}
