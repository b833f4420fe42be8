package com.work.lock.worker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 各维护任务的触发节奏（Spring cron 表达式，6 段）。
 */
@ConfigurationProperties(prefix = "worker.tasks")
public class WorkerTaskProperties {

    private String dailyCleanupCron = "0 0 2 * * *";
    private String hourlySyncCron = "0 0 * * * *";
    private String weeklyReportCron = "0 0 9 * * MON";

    /**
     * 日志保留天数（daily-cleanup 使用）
     */
    private int logRetentionDays = 30;

    /**
     * 数据归档阈值天数（daily-cleanup 使用）
     */
    private int archiveAfterDays = 90;

    public String getDailyCleanupCron() {
        return dailyCleanupCron;
    }

    public void setDailyCleanupCron(String dailyCleanupCron) {
        this.dailyCleanupCron = dailyCleanupCron;
    }

    public String getHourlySyncCron() {
        return hourlySyncCron;
    }

    public void setHourlySyncCron(String hourlySyncCron) {
        this.hourlySyncCron = hourlySyncCron;
    }

    public String getWeeklyReportCron() {
        return weeklyReportCron;
    }

    public void setWeeklyReportCron(String weeklyReportCron) {
        this.weeklyReportCron = weeklyReportCron;
    }

    public int getLogRetentionDays() {
        return logRetentionDays;
    }

    public void setLogRetentionDays(int logRetentionDays) {
        this.logRetentionDays = logRetentionDays;
    }

    public int getArchiveAfterDays() {
        return archiveAfterDays;
    }

    public void setArchiveAfterDays(int archiveAfterDays) {
        this.archiveAfterDays = archiveAfterDays;
    }
}
