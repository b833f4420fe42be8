package com.work.lock.worker.config;

import com.work.lock.core.config.LockOptions;
import com.work.lock.core.execution.GuardedTaskRegistry;
import com.work.lock.worker.tasks.MaintenanceTasks;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.support.CronTrigger;

/**
 * 受保护任务的显式注册：每个任务在这里绑定自己的锁 key、TTL 与 cron。
 */
@Configuration
public class WorkerTaskConfiguration {

    public static final String DAILY_CLEANUP = "daily-cleanup";
    public static final String HOURLY_SYNC = "hourly-sync";
    public static final String WEEKLY_REPORT = "weekly-report";

    @Bean
    public GuardedTaskRegistry guardedTaskRegistry(MaintenanceTasks tasks, WorkerTaskProperties properties) {
        return new GuardedTaskRegistry()
                .register(DAILY_CLEANUP, LockOptions.of(DAILY_CLEANUP, 3600),
                        tasks::dailyCleanup, new CronTrigger(properties.getDailyCleanupCron()))
                .register(HOURLY_SYNC, LockOptions.of(HOURLY_SYNC, 300),
                        tasks::hourlySync, new CronTrigger(properties.getHourlySyncCron()))
                .register(WEEKLY_REPORT, LockOptions.of(WEEKLY_REPORT, 1800),
                        tasks::weeklyReport, new CronTrigger(properties.getWeeklyReportCron()));
    }
}
