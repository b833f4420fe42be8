package com.work.lock.worker.config;

import com.work.lock.core.config.LockCoordinatorConfig;
import com.work.lock.core.execution.GuardedTaskRegistry;
import com.work.lock.core.execution.LockExecutionGate;
import com.work.lock.core.lock.LockCoordinator;
import com.work.lock.core.metrics.LockMetrics;
import com.work.lock.core.metrics.NoopLockMetrics;
import com.work.lock.core.store.impl.RedisLockStore;
import com.work.lock.core.support.InMemoryLockStore;
import com.work.lock.core.support.InstanceIdProvider;
import com.work.lock.core.support.ProcessInstanceIdProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 将核心锁组件装配为 Spring Bean。
 * 远程存储使用 Redis，lock.redis-enabled=false 时只保留进程内兜底存储。
 */
@Configuration
@EnableConfigurationProperties({LockProperties.class, WorkerTaskProperties.class})
public class LockCoordinatorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LockCoordinatorConfiguration.class);

    @Bean
    public LockCoordinatorConfig lockCoordinatorConfig(LockProperties properties) {
        return new LockCoordinatorConfig(properties.isRedisEnabled(), properties.getKeyPrefix());
    }

    @Bean
    @ConditionalOnMissingBean(InstanceIdProvider.class)
    public InstanceIdProvider instanceIdProvider() {
        return new ProcessInstanceIdProvider();
    }

    @Bean
    @ConditionalOnMissingBean(LockMetrics.class)
    public LockMetrics lockMetrics() {
        return new NoopLockMetrics();
    }

    @Bean
    public InMemoryLockStore fallbackLockStore() {
        return new InMemoryLockStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "lock", name = "redis-enabled", havingValue = "true", matchIfMissing = true)
    public RedisLockStore redisLockStore(StringRedisTemplate redisTemplate, LockCoordinatorConfig config) {
        return new RedisLockStore(redisTemplate, config.getKeyPrefix());
    }

    @Bean
    public LockCoordinator lockCoordinator(LockCoordinatorConfig config,
                                           ObjectProvider<RedisLockStore> redisLockStore,
                                           InMemoryLockStore fallbackLockStore,
                                           InstanceIdProvider instanceIdProvider,
                                           LockMetrics lockMetrics) {
        RedisLockStore remote = config.isRemoteEnabled() ? redisLockStore.getIfAvailable() : null;
        return new LockCoordinator(remote, fallbackLockStore, instanceIdProvider, lockMetrics);
    }

    /**
     * 多线程调度器：@Scheduled 与受保护任务共用。
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler(LockProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("guarded-task-");
        scheduler.setErrorHandler(t -> log.error("[lock] scheduled task failed", t));
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        return scheduler;
    }

    @Bean
    public LockExecutionGate lockExecutionGate(LockCoordinator lockCoordinator,
                                               GuardedTaskRegistry guardedTaskRegistry,
                                               ThreadPoolTaskScheduler taskScheduler,
                                               LockMetrics lockMetrics) {
        return new LockExecutionGate(lockCoordinator, guardedTaskRegistry, taskScheduler, lockMetrics);
    }
}
