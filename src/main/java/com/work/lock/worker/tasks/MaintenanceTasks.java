package com.work.lock.worker.tasks;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.lock.worker.config.WorkerTaskProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 多实例部署下只应在一个实例上运行的维护任务。
 * 这里只负责工作本身，加锁与触发由 {@link com.work.lock.worker.config.WorkerTaskConfiguration} 绑定。
 * 任务内的异常直接抛出，由执行闸门在释放锁之后交给调度器。
 */
@Component
public class MaintenanceTasks {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceTasks.class);

    private final WorkerTaskProperties properties;
    private final ObjectMapper objectMapper;

    public MaintenanceTasks(WorkerTaskProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public void dailyCleanup() {
        log.info("daily cleanup started");
        Instant logsBefore = Instant.now().minus(properties.getLogRetentionDays(), ChronoUnit.DAYS);
        log.info("cleaning logs older than {}", logsBefore);
        Instant archiveBefore = Instant.now().minus(properties.getArchiveAfterDays(), ChronoUnit.DAYS);
        log.info("archiving data older than {}", archiveBefore);
        log.info("daily cleanup completed");
    }

    public void hourlySync() {
        log.info("hourly sync started");
        log.info("processing pending notifications");
        log.info("syncing external data");
        log.info("hourly sync completed");
    }

    public void weeklyReport() throws JsonProcessingException {
        Map<String, Object> report = buildWeeklyReport();
        log.info("weekly report sent: {}", objectMapper.writeValueAsString(report));
    }

    Map<String, Object> buildWeeklyReport() {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("period", "Last 7 days");
        report.put("from", Instant.now().minus(7, ChronoUnit.DAYS).toString());
        report.put("generatedAt", Instant.now().toString());
        return report;
    }
}
