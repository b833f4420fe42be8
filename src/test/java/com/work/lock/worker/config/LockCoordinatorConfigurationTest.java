package com.work.lock.worker.config;

import com.work.lock.core.config.LockCoordinatorConfig;
import com.work.lock.core.config.LockOptions;
import com.work.lock.core.lock.LockCoordinator;
import com.work.lock.core.metrics.NoopLockMetrics;
import com.work.lock.core.store.impl.RedisLockStore;
import com.work.lock.core.support.InMemoryLockStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class LockCoordinatorConfigurationTest {

    private final LockCoordinatorConfiguration configuration = new LockCoordinatorConfiguration();

    @Test
    public void properties_map_to_core_config() {
        LockProperties properties = new LockProperties();
        properties.setRedisEnabled(false);
        properties.setKeyPrefix("jobs:");

        LockCoordinatorConfig config = configuration.lockCoordinatorConfig(properties);

        assertFalse(config.isRemoteEnabled());
        assertEquals("jobs:", config.getKeyPrefix());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void remote_disabled_builds_local_only_coordinator() {
        ObjectProvider<RedisLockStore> redis = mock(ObjectProvider.class);
        InMemoryLockStore fallback = new InMemoryLockStore();

        LockCoordinator coordinator = configuration.lockCoordinator(
                new LockCoordinatorConfig(false, "lock:"), redis, fallback, () -> "A", new NoopLockMetrics());

        verify(redis, never()).getIfAvailable();
        assertTrue(coordinator.acquire(LockOptions.of("job-x")));
        assertEquals("A", fallback.readOwner("job-x").orElse(null));
        assertFalse(coordinator.isDegraded());
    }
}
