package com.work.lock.core.support;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ProcessInstanceIdProviderTest {

    @Test
    public void id_is_stable_per_provider_and_unique_across_providers() {
        ProcessInstanceIdProvider a = new ProcessInstanceIdProvider();
        ProcessInstanceIdProvider b = new ProcessInstanceIdProvider();

        assertEquals(a.getInstanceId(), a.getInstanceId());
        assertNotEquals(a.getInstanceId(), b.getInstanceId());
        assertTrue(a.getInstanceId().contains("-" + ProcessHandle.current().pid() + "-"));
    }
}
