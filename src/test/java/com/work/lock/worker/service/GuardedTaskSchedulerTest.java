package com.work.lock.worker.service;

import com.work.lock.core.config.LockOptions;
import com.work.lock.core.execution.GuardedTaskDefinition;
import com.work.lock.core.execution.GuardedTaskRegistry;
import com.work.lock.core.execution.LockExecutionGate;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.support.CronTrigger;

import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class GuardedTaskSchedulerTest {

    @Test
    public void schedules_triggered_tasks_and_cancels_on_stop() {
        GuardedTaskRegistry registry = new GuardedTaskRegistry()
                .register("daily-cleanup", LockOptions.of("daily-cleanup", 3600), () -> {
                }, new CronTrigger("0 0 2 * * *"))
                .register("manual-only", LockOptions.of("manual-only"), () -> {
                }, null);
        LockExecutionGate gate = mock(LockExecutionGate.class);
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(gate).guard(any(GuardedTaskDefinition.class));

        GuardedTaskScheduler scheduler = new GuardedTaskScheduler(registry, gate);
        scheduler.start();

        assertEquals(1, scheduler.scheduledCount());
        verify(gate, times(1)).guard(any(GuardedTaskDefinition.class));

        scheduler.stop();
        verify(future).cancel(false);
        assertEquals(0, scheduler.scheduledCount());
    }
}
