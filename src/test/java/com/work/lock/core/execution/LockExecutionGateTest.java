package com.work.lock.core.execution;

import com.work.lock.core.config.LockOptions;
import com.work.lock.core.exception.GuardedOperationException;
import com.work.lock.core.lock.LockCoordinator;
import com.work.lock.core.metrics.LockMetrics;
import com.work.lock.core.support.InMemoryLockStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.PeriodicTrigger;

import java.io.IOException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class LockExecutionGateTest {

    private InMemoryLockStore sharedStore;
    private LockCoordinator self;
    private LockCoordinator other;
    private GuardedTaskRegistry registry;
    private TaskScheduler scheduler;
    private LockMetrics metrics;
    private LockExecutionGate gate;

    @BeforeEach
    public void setUp() {
        sharedStore = new InMemoryLockStore();
        metrics = mock(LockMetrics.class);
        self = new LockCoordinator(sharedStore, new InMemoryLockStore(), () -> "self", metrics);
        other = new LockCoordinator(sharedStore, new InMemoryLockStore(), () -> "other", metrics);
        registry = new GuardedTaskRegistry();
        scheduler = mock(TaskScheduler.class);
        gate = new LockExecutionGate(self, registry, scheduler, metrics);
    }

    @Test
    public void runs_work_and_releases_immediately() {
        AtomicBoolean lockedDuringRun = new AtomicBoolean(false);

        boolean executed = gate.execute(LockOptions.of("job-x"), () -> lockedDuringRun.set(other.isLocked("job-x")));

        assertTrue(executed);
        assertTrue(lockedDuringRun.get());
        assertFalse(self.isLocked("job-x"));
        verify(metrics).guardedRun("job-x", "completed");
    }

    @Test
    public void skips_work_when_lock_is_held_elsewhere() {
        assertTrue(other.acquire(LockOptions.of("job-x")));
        AtomicInteger runs = new AtomicInteger();

        boolean executed = gate.execute(LockOptions.of("job-x"), runs::incrementAndGet);

        assertFalse(executed);
        assertEquals(0, runs.get());
        // 跳过时不能释放别人的锁
        assertTrue(other.isLocked("job-x"));
        verify(metrics).guardedRun("job-x", "skipped");
    }

    @Test
    public void runtime_failure_propagates_after_release() {
        IllegalStateException boom = new IllegalStateException("boom");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> gate.execute(LockOptions.of("job-f"), () -> {
                    throw boom;
                }));

        assertSame(boom, thrown);
        assertFalse(self.isLocked("job-f"));
        assertTrue(other.acquire(LockOptions.of("job-f")));
        verify(metrics).guardedRun("job-f", "failed");
    }

    @Test
    public void checked_failure_is_wrapped_after_release() {
        IOException io = new IOException("disk");

        GuardedOperationException thrown = assertThrows(GuardedOperationException.class,
                () -> gate.execute(LockOptions.of("job-f"), () -> {
                    throw io;
                }));

        assertSame(io, thrown.getCause());
        assertEquals("job-f", thrown.getLockKey());
        assertFalse(self.isLocked("job-f"));
    }

    @Test
    public void guard_binds_trigger_and_each_firing_goes_through_the_lock() {
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        Trigger trigger = new PeriodicTrigger(1000);
        doReturn(future).when(scheduler).schedule(any(Runnable.class), eq(trigger));
        AtomicInteger runs = new AtomicInteger();

        assertSame(future, gate.guard(LockOptions.of("job-p"), runs::incrementAndGet, trigger));

        ArgumentCaptor<Runnable> firing = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(firing.capture(), eq(trigger));

        firing.getValue().run();
        assertEquals(1, runs.get());

        assertTrue(other.acquire(LockOptions.of("job-p")));
        firing.getValue().run();
        assertEquals(1, runs.get());
    }

    @Test
    public void scheduled_firing_failure_reaches_the_trigger_source() {
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        Trigger trigger = new PeriodicTrigger(1000);
        doReturn(future).when(scheduler).schedule(any(Runnable.class), eq(trigger));

        gate.guard(LockOptions.of("job-p"), () -> {
            throw new IllegalStateException("boom");
        }, trigger);

        ArgumentCaptor<Runnable> firing = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(firing.capture(), eq(trigger));
        assertThrows(IllegalStateException.class, () -> firing.getValue().run());
        assertFalse(self.isLocked("job-p"));
    }

    @Test
    public void manual_trigger_uses_registered_options() {
        AtomicInteger runs = new AtomicInteger();
        registry.register("cleanup", LockOptions.of("daily-cleanup", 3600), runs::incrementAndGet, null);

        assertTrue(gate.trigger("cleanup"));
        assertEquals(1, runs.get());

        assertTrue(other.acquire(LockOptions.of("daily-cleanup")));
        assertFalse(gate.trigger("cleanup"));
        assertEquals(1, runs.get());
    }

    @Test
    public void manual_trigger_of_unknown_task_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> gate.trigger("missing"));
    }
}
